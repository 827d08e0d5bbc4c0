package org.nowstart.backtester.data.type;

public enum RunState {
    UNCONFIGURED,
    CREATED,
    RUNNING,
    COMPLETED,
    STOPPED,
    FAILED
}
