package org.nowstart.backtester.strategy;

import java.util.function.Supplier;

/**
 * Registered strategy constructor. Each run gets its own instance.
 */
public record StrategyFactory(String name, Supplier<Strategy> supplier) {

    public Strategy create() {
        return supplier.get();
    }
}
