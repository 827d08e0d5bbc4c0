package org.nowstart.backtester.portfolio;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.CurrencyPair;
import org.nowstart.backtester.data.dto.ExecutionSettings;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.AssetType;
import org.nowstart.backtester.data.type.OrderType;
import org.nowstart.backtester.event.BacktestEvent;
import org.nowstart.backtester.event.DataEvent;
import org.nowstart.backtester.event.FillEvent;
import org.nowstart.backtester.event.OrderEvent;
import org.nowstart.backtester.event.SignalEvent;
import org.nowstart.backtester.portfolio.risk.Risk;
import org.nowstart.backtester.portfolio.risk.RiskDecision;
import org.nowstart.backtester.portfolio.size.Size;

/**
 * Owns holdings per pair and turns signals into orders through sizing and risk checks.
 * Holdings change only when a filled {@link FillEvent} is applied.
 */
@Slf4j
public class Portfolio {

    private final Size size;
    private final Risk risk;
    @Getter
    private final double riskFreeRate;
    private final Map<PairKey, ExecutionSettings> settings = new LinkedHashMap<>();
    private final Map<PairKey, Holdings> holdings = new LinkedHashMap<>();

    private Portfolio(Size size, Risk risk, double riskFreeRate) {
        this.size = size;
        this.risk = risk;
        this.riskFreeRate = riskFreeRate;
    }

    public static Portfolio setup(Size size, Risk risk, double riskFreeRate) {
        if (size == null || risk == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "size and risk are required");
        }
        if (riskFreeRate < 0 || Double.isNaN(riskFreeRate)) {
            throw new BacktestException(ErrorCode.INVALID_CURRENCY_SETTINGS,
                    "riskFreeRate must not be negative. riskFreeRate=" + riskFreeRate);
        }
        return new Portfolio(size, risk, riskFreeRate);
    }

    public void setupCurrencySettingsMap(String exchange, AssetType asset, CurrencyPair pair) {
        setupCurrencySettingsMap(toKey(exchange, asset, pair), ExecutionSettings.DEFAULT);
    }

    public void setupCurrencySettingsMap(PairKey key, ExecutionSettings executionSettings) {
        if (key == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "pair key is required");
        }
        settings.put(key, executionSettings == null ? ExecutionSettings.DEFAULT : executionSettings);
        holdings.putIfAbsent(key, Holdings.initial(key, 0));
    }

    public void setInitialFunds(String exchange, AssetType asset, CurrencyPair pair, double funds) {
        setInitialFunds(toKey(exchange, asset, pair), funds);
    }

    public void setInitialFunds(PairKey key, double funds) {
        requireSettings(key);
        if (!(funds > 0)) {
            throw new BacktestException(ErrorCode.BAD_INITIAL_FUNDS,
                    "initial funds must be greater than zero. key=" + key + ", funds=" + funds);
        }
        holdings.put(key, Holdings.initial(key, funds));
    }

    public double getInitialFunds(PairKey key) {
        requireSettings(key);
        return holdings.get(key).initialFunds();
    }

    public ExecutionSettings getExecutionSettings(PairKey key) {
        return requireSettings(key);
    }

    public Holdings viewHoldings(PairKey key) {
        requireSettings(key);
        return holdings.get(key);
    }

    public Holdings viewHoldings(String exchange, AssetType asset, CurrencyPair pair) {
        return viewHoldings(toKey(exchange, asset, pair));
    }

    /**
     * Returns empty for HOLD, a rejected fill when sizing or risk refuses the trade, otherwise an order.
     */
    public Optional<BacktestEvent> onSignal(SignalEvent signal, DataEvent data) {
        if (signal == null || data == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "signal and data are required");
        }
        ExecutionSettings pairSettings = requireSettings(signal.key());
        if (signal.isHold()) {
            return Optional.empty();
        }

        Holdings current = holdings.get(signal.key());
        double price = data.closePrice();
        // limit orders are sized at the limit so risk checks see the same cost
        double sizingPrice = signal.limitPrice() != null ? signal.limitPrice() : price;
        double amount;
        try {
            amount = size.sizeOrder(signal, sizingPrice, current, pairSettings);
        } catch (BacktestException e) {
            if (e.getCode() != ErrorCode.AMOUNT_BELOW_MINIMUM && e.getCode() != ErrorCode.NO_FUNDS) {
                throw e;
            }
            log.info("event=signal_rejected key={} ts={} direction={} code={} reason={}",
                    signal.key(), signal.timestamp(), signal.direction(), e.getCode(), e.getMessage());
            return Optional.of(FillEvent.rejected(signal, e.getMessage()));
        }

        OrderEvent order = new OrderEvent(
                signal.key(),
                signal.timestamp(),
                signal.direction(),
                amount,
                signal.limitPrice() != null ? OrderType.LIMIT : OrderType.MARKET,
                signal.limitPrice(),
                price,
                signal.reason()
        );

        RiskDecision decision = risk.evaluate(order, current, pairSettings);
        if (!decision.approved()) {
            log.info("event=order_rejected key={} ts={} direction={} amount={} reason={}",
                    order.key(), order.timestamp(), order.direction(), order.amount(), decision.reason());
            return Optional.of(FillEvent.rejected(order, decision.reason()));
        }
        return Optional.of(order);
    }

    public Holdings onFill(FillEvent fill) {
        if (fill == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "fill is required");
        }
        requireSettings(fill.key());
        Holdings current = holdings.get(fill.key());
        if (!fill.isFilled()) {
            return current;
        }

        Holdings updated = current.apply(fill);
        holdings.put(fill.key(), updated);
        log.debug("event=holdings_updated key={} ts={} quantity={} funds={} fees={}",
                fill.key(), fill.timestamp(), updated.quantity(), updated.remainingFunds(), updated.totalFees());
        return updated;
    }

    private ExecutionSettings requireSettings(PairKey key) {
        ExecutionSettings pairSettings = key == null ? null : settings.get(key);
        if (pairSettings == null) {
            throw new BacktestException(ErrorCode.CURRENCY_SETTINGS_NOT_FOUND, "no currency settings for " + key);
        }
        return pairSettings;
    }

    private static PairKey toKey(String exchange, AssetType asset, CurrencyPair pair) {
        try {
            return PairKey.of(exchange, asset, pair);
        } catch (IllegalArgumentException e) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, e.getMessage(), e);
        }
    }
}
