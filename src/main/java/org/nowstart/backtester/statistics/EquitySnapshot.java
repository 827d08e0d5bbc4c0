package org.nowstart.backtester.statistics;

import java.time.Instant;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.data.type.OrderStatus;
import org.nowstart.backtester.event.DataEvent;
import org.nowstart.backtester.event.FillEvent;
import org.nowstart.backtester.event.SignalEvent;
import org.nowstart.backtester.portfolio.Holdings;

/**
 * One equity point: holdings valued at the close of a data event, plus what happened on that event.
 * {@code status} is null when the strategy held.
 */
public record EquitySnapshot(
        PairKey key,
        Instant timestamp,
        double closePrice,
        double initialFunds,
        double quantity,
        double remainingFunds,
        double totalValue,
        Direction direction,
        OrderStatus status,
        double amount,
        double fillPrice,
        double fee,
        String reason
) {

    public static EquitySnapshot ofHold(DataEvent data, Holdings holdings, SignalEvent signal) {
        return new EquitySnapshot(
                data.key(),
                data.timestamp(),
                data.closePrice(),
                holdings.initialFunds(),
                holdings.quantity(),
                holdings.remainingFunds(),
                holdings.totalValue(data.closePrice()),
                Direction.HOLD,
                null,
                0,
                0,
                0,
                signal.reason()
        );
    }

    public static EquitySnapshot ofFill(DataEvent data, Holdings holdings, FillEvent fill) {
        return new EquitySnapshot(
                data.key(),
                data.timestamp(),
                data.closePrice(),
                holdings.initialFunds(),
                holdings.quantity(),
                holdings.remainingFunds(),
                holdings.totalValue(data.closePrice()),
                fill.direction(),
                fill.status(),
                fill.amount(),
                fill.fillPrice(),
                fill.fee(),
                fill.reason()
        );
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }

    public boolean isRejected() {
        return status == OrderStatus.REJECTED;
    }
}
