package org.nowstart.backtester.statistics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.Direction;

/**
 * Append-only equity history for one pair.
 */
public class CurrencyStatistic {

    private final PairKey key;
    private final List<EquitySnapshot> snapshots = new ArrayList<>();

    public CurrencyStatistic(PairKey key) {
        this.key = key;
    }

    public void append(EquitySnapshot snapshot) {
        if (!snapshots.isEmpty()) {
            Instant last = snapshots.get(snapshots.size() - 1).timestamp();
            if (snapshot.timestamp().isBefore(last)) {
                throw new BacktestException(ErrorCode.OUT_OF_ORDER_EVENT,
                        "snapshot timestamp " + snapshot.timestamp() + " precedes " + last + " for " + key);
            }
        }
        snapshots.add(snapshot);
    }

    public List<EquitySnapshot> snapshots() {
        return Collections.unmodifiableList(snapshots);
    }

    public CurrencyStatisticResult calculate(double riskFreeRate) {
        if (snapshots.isEmpty()) {
            return new CurrencyStatisticResult(key, 0, null, null, 0, 0, 0, 0, 0, null, null, 0, 0, 0, 0, 0, 0,
                    Double.NaN, 0);
        }

        EquitySnapshot first = snapshots.get(0);
        EquitySnapshot last = snapshots.get(snapshots.size() - 1);
        double initialFunds = first.initialFunds();
        double totalReturnPct = initialFunds > 0 ? (last.totalValue() / initialFunds - 1.0) * 100.0 : 0;
        double marketMovementPct = first.closePrice() > 0 ? (last.closePrice() / first.closePrice() - 1.0) * 100.0 : 0;

        int buyOrders = 0;
        int sellOrders = 0;
        int rejectedOrders = 0;
        int holdSignals = 0;
        double totalFees = 0;
        for (EquitySnapshot snapshot : snapshots) {
            if (snapshot.status() == null) {
                holdSignals++;
            } else if (snapshot.isRejected()) {
                rejectedOrders++;
            } else if (snapshot.direction() == Direction.BUY) {
                buyOrders++;
            } else if (snapshot.direction() == Direction.SELL) {
                sellOrders++;
            }
            totalFees += snapshot.fee();
        }

        Drawdown drawdown = maxDrawdown();
        RoundTrips roundTrips = roundTrips();

        return new CurrencyStatisticResult(
                key,
                snapshots.size(),
                first.timestamp(),
                last.timestamp(),
                initialFunds,
                last.totalValue(),
                totalReturnPct,
                marketMovementPct,
                drawdown.pct(),
                drawdown.peakAt(),
                drawdown.troughAt(),
                sharpe(riskFreeRate),
                buyOrders,
                sellOrders,
                rejectedOrders,
                holdSignals,
                roundTrips.closed(),
                roundTrips.closed() > 0 ? (roundTrips.wins() * 100.0) / roundTrips.closed() : Double.NaN,
                totalFees
        );
    }

    private Drawdown maxDrawdown() {
        double peak = snapshots.get(0).totalValue();
        Instant peakAt = snapshots.get(0).timestamp();
        double worst = 0.0;
        Instant worstPeakAt = null;
        Instant worstTroughAt = null;
        for (EquitySnapshot snapshot : snapshots) {
            if (snapshot.totalValue() > peak) {
                peak = snapshot.totalValue();
                peakAt = snapshot.timestamp();
            }
            if (peak > 0.0) {
                double drawdown = (snapshot.totalValue() / peak - 1.0) * 100.0;
                if (drawdown < worst) {
                    worst = drawdown;
                    worstPeakAt = peakAt;
                    worstTroughAt = snapshot.timestamp();
                }
            }
        }
        return new Drawdown(worst, worstPeakAt, worstTroughAt);
    }

    // per-step excess return over its standard deviation; riskFreeRate is per step
    private double sharpe(double riskFreeRate) {
        if (snapshots.size() < 3) {
            return 0;
        }
        double[] returns = new double[snapshots.size() - 1];
        for (int i = 1; i < snapshots.size(); i++) {
            double previous = snapshots.get(i - 1).totalValue();
            returns[i - 1] = previous > 0 ? snapshots.get(i).totalValue() / previous - 1.0 : 0;
        }
        double mean = 0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.length;
        double variance = 0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        double stdev = Math.sqrt(variance / (returns.length - 1));
        if (stdev == 0.0 || !Double.isFinite(stdev)) {
            return 0;
        }
        return (mean - riskFreeRate) / stdev;
    }

    private RoundTrips roundTrips() {
        double positionQty = 0.0;
        double costBasis = 0.0;
        double roundTripPnl = 0.0;
        int closed = 0;
        int wins = 0;

        for (EquitySnapshot snapshot : snapshots) {
            if (!snapshot.isFilled() || snapshot.amount() <= 0.0) {
                continue;
            }
            double notional = snapshot.fillPrice() * snapshot.amount();
            if (snapshot.direction() == Direction.BUY) {
                positionQty += snapshot.amount();
                costBasis += notional + snapshot.fee();
                continue;
            }

            double sellQty = Math.min(positionQty, snapshot.amount());
            if (sellQty <= 0.0) {
                continue;
            }
            double matchedCost = costBasis * (sellQty / positionQty);
            roundTripPnl += notional - snapshot.fee() - matchedCost;
            costBasis -= matchedCost;
            positionQty -= sellQty;
            if (positionQty <= 1e-12) {
                closed++;
                if (roundTripPnl > 0.0) {
                    wins++;
                }
                positionQty = 0.0;
                costBasis = 0.0;
                roundTripPnl = 0.0;
            }
        }
        return new RoundTrips(closed, wins);
    }

    private record Drawdown(double pct, Instant peakAt, Instant troughAt) {
    }

    private record RoundTrips(int closed, int wins) {
    }
}
