package org.nowstart.backtester.event;

import java.time.Instant;
import java.util.Objects;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.data.type.OrderType;

public record OrderEvent(
        PairKey key,
        Instant timestamp,
        Direction direction,
        double amount,
        OrderType orderType,
        Double limitPrice,
        double closePrice,
        String reason
) implements BacktestEvent {

    public OrderEvent {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(orderType, "orderType");
        if (direction == Direction.HOLD) {
            throw new IllegalArgumentException("order direction must be BUY or SELL");
        }
        if (orderType == OrderType.LIMIT && limitPrice == null) {
            throw new IllegalArgumentException("limit order requires limitPrice");
        }
        reason = reason == null ? "" : reason;
    }
}
