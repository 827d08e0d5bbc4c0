package org.nowstart.backtester.data.type;

public enum Direction {
    BUY,
    SELL,
    HOLD
}
