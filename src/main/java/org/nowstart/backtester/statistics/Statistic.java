package org.nowstart.backtester.statistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;

/**
 * Equity history for every pair of a run.
 */
public class Statistic {

    @Getter
    private final double riskFreeRate;
    private final Map<PairKey, CurrencyStatistic> currencies = new LinkedHashMap<>();
    private boolean finalised;

    public Statistic(double riskFreeRate) {
        this.riskFreeRate = riskFreeRate;
    }

    public void setupPair(PairKey key) {
        currencies.putIfAbsent(key, new CurrencyStatistic(key));
    }

    public void update(EquitySnapshot snapshot) {
        if (snapshot == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "snapshot is required");
        }
        if (finalised) {
            throw new IllegalStateException("statistics already finalised");
        }
        currencies.computeIfAbsent(snapshot.key(), CurrencyStatistic::new).append(snapshot);
    }

    public Optional<CurrencyStatistic> getCurrencyStatistic(PairKey key) {
        return Optional.ofNullable(currencies.get(key));
    }

    public List<PairKey> pairs() {
        return List.copyOf(currencies.keySet());
    }

    public int equityPoints() {
        return currencies.values().stream().mapToInt(statistic -> statistic.snapshots().size()).sum();
    }

    /**
     * Derives the summary from recorded history. Calling it again returns an equal summary.
     */
    public StatisticsSummary calculateAll() {
        List<CurrencyStatisticResult> results = new ArrayList<>();
        double totalInitial = 0;
        double totalFinal = 0;
        double worstDrawdown = 0;
        int totalOrders = 0;
        int rejected = 0;
        int closedTrades = 0;
        double weightedWins = 0;

        for (CurrencyStatistic statistic : currencies.values()) {
            CurrencyStatisticResult result = statistic.calculate(riskFreeRate);
            results.add(result);
            totalInitial += result.initialFunds();
            totalFinal += result.finalValue();
            worstDrawdown = Math.min(worstDrawdown, result.maxDrawdownPct());
            totalOrders += result.buyOrders() + result.sellOrders() + result.rejectedOrders();
            rejected += result.rejectedOrders();
            closedTrades += result.closedTrades();
            if (result.closedTrades() > 0) {
                weightedWins += result.winRatePct() * result.closedTrades();
            }
        }

        return new StatisticsSummary(
                List.copyOf(results),
                totalInitial,
                totalFinal,
                totalInitial > 0 ? (totalFinal / totalInitial - 1.0) * 100.0 : 0,
                worstDrawdown,
                totalOrders,
                rejected,
                closedTrades,
                closedTrades > 0 ? weightedWins / closedTrades : Double.NaN
        );
    }

    public void markFinalised() {
        finalised = true;
    }

    public boolean isFinalised() {
        return finalised;
    }
}
