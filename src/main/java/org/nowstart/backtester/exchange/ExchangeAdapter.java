package org.nowstart.backtester.exchange;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.nowstart.backtester.data.dto.CredentialsValidator;
import org.nowstart.backtester.data.dto.CurrencyPair;
import org.nowstart.backtester.data.dto.ExchangeCredentials;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.type.AssetType;

/**
 * Market data access to one venue. Backtests only read from it; orders are simulated.
 */
public interface ExchangeAdapter {

    String name();

    ExchangeCredentials getCredentials();

    void setCredentials(ExchangeCredentials credentials);

    CredentialsValidator credentialsValidator();

    default List<String> validateCredentials() {
        return credentialsValidator().validate(getCredentials());
    }

    default boolean areCredentialsValid() {
        return validateCredentials().isEmpty();
    }

    /**
     * Candles with {@code start <= timestamp < end}, oldest first.
     */
    List<OhlcvCandle> fetchHistoricCandles(
            CurrencyPair pair,
            AssetType asset,
            Instant start,
            Instant end,
            Duration interval
    );

    Optional<OhlcvCandle> fetchLatestCandle(CurrencyPair pair, AssetType asset, Duration interval);
}
