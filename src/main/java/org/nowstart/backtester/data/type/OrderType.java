package org.nowstart.backtester.data.type;

public enum OrderType {
    MARKET,
    LIMIT
}
