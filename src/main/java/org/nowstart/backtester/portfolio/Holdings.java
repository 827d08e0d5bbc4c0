package org.nowstart.backtester.portfolio;

import java.time.Instant;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.event.FillEvent;

/**
 * Immutable position and cash snapshot for one pair.
 */
public record Holdings(
        PairKey key,
        Instant timestamp,
        double initialFunds,
        double quantity,
        double remainingFunds,
        double averageCost,
        double boughtAmount,
        double boughtValue,
        double soldAmount,
        double soldValue,
        double realisedPnl,
        double totalFees
) {

    static final double TOLERANCE = 1e-8;

    public static Holdings initial(PairKey key, double initialFunds) {
        return new Holdings(key, null, initialFunds, 0, initialFunds, 0, 0, 0, 0, 0, 0, 0);
    }

    public double totalValue(double price) {
        return remainingFunds + quantity * price;
    }

    public Holdings apply(FillEvent fill) {
        if (fill.direction() == Direction.HOLD) {
            throw new IllegalArgumentException("cannot apply HOLD fill");
        }
        double notional = fill.amount() * fill.fillPrice();

        if (fill.direction() == Direction.BUY) {
            double funds = remainingFunds - notional - fill.fee();
            if (funds < -TOLERANCE) {
                throw new BacktestException(ErrorCode.NEGATIVE_HOLDINGS,
                        "buy would leave negative funds. key=" + key + ", funds=" + funds);
            }
            double newQuantity = quantity + fill.amount();
            double newAverage = newQuantity > 0 ? (averageCost * quantity + notional) / newQuantity : 0;
            return new Holdings(key, fill.timestamp(), initialFunds, newQuantity, Math.max(0, funds), newAverage,
                    boughtAmount + fill.amount(), boughtValue + notional, soldAmount, soldValue, realisedPnl,
                    totalFees + fill.fee());
        }

        double newQuantity = quantity - fill.amount();
        if (newQuantity < -TOLERANCE) {
            throw new BacktestException(ErrorCode.NEGATIVE_HOLDINGS,
                    "sell would leave negative quantity. key=" + key + ", quantity=" + newQuantity);
        }
        double funds = remainingFunds + notional - fill.fee();
        if (funds < -TOLERANCE) {
            throw new BacktestException(ErrorCode.NEGATIVE_HOLDINGS,
                    "sell would leave negative funds. key=" + key + ", funds=" + funds);
        }
        double pnl = (fill.fillPrice() - averageCost) * fill.amount() - fill.fee();
        boolean flat = newQuantity <= TOLERANCE;
        return new Holdings(key, fill.timestamp(), initialFunds, flat ? 0 : newQuantity, Math.max(0, funds),
                flat ? 0 : averageCost, boughtAmount, boughtValue, soldAmount + fill.amount(), soldValue + notional,
                realisedPnl + pnl, totalFees + fill.fee());
    }
}
