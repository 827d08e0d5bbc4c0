package org.nowstart.backtester.strategy.rsi;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Getter;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.event.DataEvent;
import org.nowstart.backtester.event.SignalEvent;
import org.nowstart.backtester.strategy.BaseStrategy;
import org.nowstart.backtester.strategy.SettingValue;
import org.nowstart.backtester.strategy.StrategyInput;

/**
 * Buys when Wilder RSI is oversold and sells when it is overbought.
 */
@Getter
public class RsiStrategy extends BaseStrategy {

    public static final String NAME = "rsi";
    public static final String KEY_RSI_HIGH = "rsi-high";
    public static final String KEY_RSI_LOW = "rsi-low";
    public static final String KEY_RSI_PERIOD = "rsi-period";

    private static final double DEFAULT_HIGH = 70;
    private static final double DEFAULT_LOW = 30;
    private static final int DEFAULT_PERIOD = 14;

    private double rsiHigh = DEFAULT_HIGH;
    private double rsiLow = DEFAULT_LOW;
    private int rsiPeriod = DEFAULT_PERIOD;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Relative strength index. Buys below rsi-low, sells above rsi-high, holds otherwise";
    }

    @Override
    public SignalEvent onSignal(StrategyInput input) {
        DataEvent data = requireLatest(input);
        List<OhlcvCandle> history = input.data().history();
        if (history.size() <= rsiPeriod) {
            return signal(data, Direction.HOLD, "insufficient history. candles=" + history.size());
        }

        double rsi = wilderRsi(history, rsiPeriod);
        if (rsi >= rsiHigh) {
            return signal(data, Direction.SELL, String.format(Locale.ROOT, "rsi=%.2f >= %.2f", rsi, rsiHigh));
        }
        if (rsi <= rsiLow) {
            return signal(data, Direction.BUY, String.format(Locale.ROOT, "rsi=%.2f <= %.2f", rsi, rsiLow));
        }
        return signal(data, Direction.HOLD, String.format(Locale.ROOT, "rsi=%.2f", rsi));
    }

    @Override
    public boolean supportsSimultaneousProcessing() {
        return true;
    }

    @Override
    public void setCustomSettings(Map<String, SettingValue> settings) {
        double high = rsiHigh;
        double low = rsiLow;
        int period = rsiPeriod;
        for (Map.Entry<String, SettingValue> entry : settings.entrySet()) {
            switch (entry.getKey()) {
                case KEY_RSI_HIGH -> high = entry.getValue().asDouble(KEY_RSI_HIGH);
                case KEY_RSI_LOW -> low = entry.getValue().asDouble(KEY_RSI_LOW);
                case KEY_RSI_PERIOD -> period = entry.getValue().asInt(KEY_RSI_PERIOD);
                default -> throw new BacktestException(ErrorCode.INVALID_STRATEGY_SETTINGS,
                        "unsupported setting for " + NAME + ": " + entry.getKey());
            }
        }
        validate(high, low, period);
        this.rsiHigh = high;
        this.rsiLow = low;
        this.rsiPeriod = period;
    }

    @Override
    public void setDefaults() {
        rsiHigh = DEFAULT_HIGH;
        rsiLow = DEFAULT_LOW;
        rsiPeriod = DEFAULT_PERIOD;
    }

    static double wilderRsi(List<OhlcvCandle> candles, int period) {
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = candles.get(i).close() - candles.get(i - 1).close();
            gain += Math.max(change, 0.0);
            loss += Math.max(-change, 0.0);
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        for (int i = period + 1; i < candles.size(); i++) {
            double change = candles.get(i).close() - candles.get(i - 1).close();
            avgGain = (avgGain * (period - 1) + Math.max(change, 0.0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0.0)) / period;
        }
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        return 100.0 - 100.0 / (1.0 + avgGain / avgLoss);
    }

    private static void validate(double high, double low, int period) {
        if (high <= 0 || high > 100 || low < 0 || low >= 100) {
            throw new BacktestException(ErrorCode.INVALID_STRATEGY_SETTINGS,
                    "rsi bounds must be within 0-100. high=" + high + ", low=" + low);
        }
        if (low >= high) {
            throw new BacktestException(ErrorCode.INVALID_STRATEGY_SETTINGS,
                    "rsi-low must be below rsi-high. high=" + high + ", low=" + low);
        }
        if (period < 1) {
            throw new BacktestException(ErrorCode.INVALID_STRATEGY_SETTINGS, "rsi-period must be positive");
        }
    }
}
