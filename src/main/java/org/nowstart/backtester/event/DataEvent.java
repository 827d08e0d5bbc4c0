package org.nowstart.backtester.event;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.dto.PairKey;

public record DataEvent(
        PairKey key,
        Instant timestamp,
        Duration interval,
        OhlcvCandle candle
) implements BacktestEvent {

    public DataEvent {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(candle, "candle");
    }

    public static DataEvent of(PairKey key, Duration interval, OhlcvCandle candle) {
        return new DataEvent(key, candle.timestamp(), interval, candle);
    }

    public double closePrice() {
        return candle.close();
    }
}
