package org.nowstart.backtester.event;

import java.time.Instant;
import java.util.Objects;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.type.Direction;

/**
 * Strategy intent for one data event. {@code amount} of zero leaves sizing to the portfolio;
 * a non-null {@code limitPrice} requests a limit order.
 */
public record SignalEvent(
        PairKey key,
        Instant timestamp,
        Direction direction,
        double amount,
        Double limitPrice,
        double closePrice,
        String reason
) implements BacktestEvent {

    public SignalEvent {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(direction, "direction");
        reason = reason == null ? "" : reason;
    }

    public static SignalEvent of(DataEvent data, Direction direction, String reason) {
        return new SignalEvent(data.key(), data.timestamp(), direction, 0, null, data.closePrice(), reason);
    }

    public boolean isHold() {
        return direction == Direction.HOLD;
    }
}
