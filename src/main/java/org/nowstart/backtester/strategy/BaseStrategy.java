package org.nowstart.backtester.strategy;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.event.DataEvent;
import org.nowstart.backtester.event.SignalEvent;

public abstract class BaseStrategy implements Strategy {

    private boolean simultaneousProcessing;

    @Override
    public boolean usingSimultaneousProcessing() {
        return simultaneousProcessing;
    }

    @Override
    public void setSimultaneousProcessing(boolean simultaneous) {
        this.simultaneousProcessing = simultaneous;
    }

    @Override
    public List<SignalEvent> onSimultaneousSignals(List<StrategyInput> inputs) {
        if (!supportsSimultaneousProcessing()) {
            throw new BacktestException(ErrorCode.MULTI_CURRENCY_UNSUPPORTED, name() + " " +
                    ErrorCode.MULTI_CURRENCY_UNSUPPORTED.getDefaultMessage());
        }
        List<SignalEvent> signals = new ArrayList<>(inputs.size());
        for (StrategyInput input : inputs) {
            signals.add(onSignal(input));
        }
        return signals;
    }

    protected DataEvent requireLatest(StrategyInput input) {
        if (input == null || input.data() == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "strategy input is required");
        }
        return input.data().latest().orElseThrow(() -> new BacktestException(ErrorCode.INVALID_SIGNAL,
                "no data event available for " + input.data().key()));
    }

    protected SignalEvent signal(DataEvent data, Direction direction, String reason) {
        return SignalEvent.of(data, direction, reason);
    }
}
