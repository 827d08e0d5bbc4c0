package org.nowstart.backtester.strategy.dca;

import java.util.Map;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.event.DataEvent;
import org.nowstart.backtester.event.SignalEvent;
import org.nowstart.backtester.strategy.BaseStrategy;
import org.nowstart.backtester.strategy.SettingValue;
import org.nowstart.backtester.strategy.StrategyInput;

/**
 * Buys on every candle.
 */
public class DollarCostAverageStrategy extends BaseStrategy {

    public static final String NAME = "dollarcostaverage";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Dollar cost averaging. Signals a buy on every candle and leaves sizing to the portfolio";
    }

    @Override
    public SignalEvent onSignal(StrategyInput input) {
        DataEvent data = requireLatest(input);
        return signal(data, Direction.BUY, "DCA purchase");
    }

    @Override
    public boolean supportsSimultaneousProcessing() {
        return true;
    }

    @Override
    public void setCustomSettings(Map<String, SettingValue> settings) {
        throw new BacktestException(ErrorCode.CUSTOM_SETTINGS_UNSUPPORTED, NAME + " does not support custom settings");
    }

    @Override
    public void setDefaults() {
        // no settings
    }
}
