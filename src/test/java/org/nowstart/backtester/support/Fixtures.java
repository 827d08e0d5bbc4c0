package org.nowstart.backtester.support;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.backtester.data.dto.CurrencyPair;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.type.AssetType;

public final class Fixtures {

    public static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    public static final Duration FIFTEEN_MINUTES = Duration.ofMinutes(15);
    public static final PairKey BTC_USDT = PairKey.of("binance", AssetType.SPOT, CurrencyPair.of("BTC", "USDT"));
    public static final PairKey ETH_USDT = PairKey.of("binance", AssetType.SPOT, CurrencyPair.of("ETH", "USDT"));

    private Fixtures() {
    }

    public static OhlcvCandle candle(Instant ts, double close) {
        return new OhlcvCandle(ts, close, close, close, close, 1000);
    }

    public static List<OhlcvCandle> candles(Instant start, Duration interval, double... closes) {
        List<OhlcvCandle> out = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            out.add(candle(start.plus(interval.multipliedBy(i)), closes[i]));
        }
        return out;
    }
}
