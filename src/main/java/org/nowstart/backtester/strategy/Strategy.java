package org.nowstart.backtester.strategy;

import java.util.List;
import java.util.Map;
import org.nowstart.backtester.event.SignalEvent;

/**
 * Decision logic invoked once per data event. Implementations are stateful per run.
 */
public interface Strategy {

    String name();

    String description();

    SignalEvent onSignal(StrategyInput input);

    /**
     * One signal per input, in input order.
     */
    List<SignalEvent> onSimultaneousSignals(List<StrategyInput> inputs);

    boolean supportsSimultaneousProcessing();

    boolean usingSimultaneousProcessing();

    void setSimultaneousProcessing(boolean simultaneous);

    void setCustomSettings(Map<String, SettingValue> settings);

    void setDefaults();
}
