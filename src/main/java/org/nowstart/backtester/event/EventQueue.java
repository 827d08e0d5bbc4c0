package org.nowstart.backtester.event;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;

/**
 * FIFO queue owned by a single run. Not thread-safe; only the run loop touches it.
 */
public class EventQueue {

    private final Deque<BacktestEvent> events = new ArrayDeque<>();

    public void push(BacktestEvent event) {
        if (event == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "cannot push nil event");
        }
        events.addLast(event);
    }

    public Optional<BacktestEvent> pop() {
        return Optional.ofNullable(events.pollFirst());
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
