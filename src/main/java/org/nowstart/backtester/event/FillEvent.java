package org.nowstart.backtester.event;

import java.time.Instant;
import java.util.Objects;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.data.type.OrderStatus;

public record FillEvent(
        PairKey key,
        Instant timestamp,
        Direction direction,
        double amount,
        double fillPrice,
        double fee,
        OrderStatus status,
        String reason
) implements BacktestEvent {

    public FillEvent {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(status, "status");
        reason = reason == null ? "" : reason;
    }

    public static FillEvent filled(OrderEvent order, double fillPrice, double fee) {
        return new FillEvent(order.key(), order.timestamp(), order.direction(), order.amount(), fillPrice, fee,
                OrderStatus.FILLED, order.reason());
    }

    public static FillEvent rejected(OrderEvent order, String reason) {
        return new FillEvent(order.key(), order.timestamp(), order.direction(), order.amount(), order.closePrice(), 0,
                OrderStatus.REJECTED, reason);
    }

    public static FillEvent rejected(SignalEvent signal, String reason) {
        return new FillEvent(signal.key(), signal.timestamp(), signal.direction(), 0, signal.closePrice(), 0,
                OrderStatus.REJECTED, reason);
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }
}
