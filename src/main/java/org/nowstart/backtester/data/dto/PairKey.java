package org.nowstart.backtester.data.dto;

import java.util.Locale;
import org.nowstart.backtester.data.type.AssetType;

/**
 * Identity of one traded instrument on one exchange. Every event, data handler,
 * holdings snapshot and statistics series is keyed by it.
 */
public record PairKey(String exchange, AssetType asset, CurrencyPair pair) {

    public PairKey {
        if (exchange == null || exchange.isBlank() || asset == null || pair == null) {
            throw new IllegalArgumentException("exchange, asset and pair are required");
        }
        exchange = exchange.trim().toLowerCase(Locale.ROOT);
    }

    public static PairKey of(String exchange, AssetType asset, CurrencyPair pair) {
        return new PairKey(exchange, asset, pair);
    }

    @Override
    public String toString() {
        return exchange + ":" + asset.value() + ":" + pair;
    }
}
