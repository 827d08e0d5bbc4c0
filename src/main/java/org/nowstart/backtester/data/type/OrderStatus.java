package org.nowstart.backtester.data.type;

public enum OrderStatus {
    FILLED,
    REJECTED
}
