package org.nowstart.backtester.exchange;

import java.util.Optional;

/**
 * Resolves exchange adapters by name for a backtest.
 */
@FunctionalInterface
public interface HostEngine {

    Optional<ExchangeAdapter> getExchangeByName(String name);
}
