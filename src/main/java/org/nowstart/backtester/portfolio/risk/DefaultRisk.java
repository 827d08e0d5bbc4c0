package org.nowstart.backtester.portfolio.risk;

import org.nowstart.backtester.data.dto.ExecutionSettings;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.event.OrderEvent;
import org.nowstart.backtester.portfolio.Holdings;

/**
 * Cash, holdings and exposure checks. The pair's holdings ratio overrides the portfolio default when set.
 */
public class DefaultRisk implements Risk {

    private static final double TOLERANCE = 1e-8;

    private final double maximumHoldingsRatio;

    public DefaultRisk(double maximumHoldingsRatio) {
        if (maximumHoldingsRatio < 0 || maximumHoldingsRatio > 1) {
            throw new IllegalArgumentException("maximumHoldingsRatio must be between 0 and 1");
        }
        this.maximumHoldingsRatio = maximumHoldingsRatio;
    }

    public DefaultRisk() {
        this(0);
    }

    @Override
    public RiskDecision evaluate(OrderEvent order, Holdings holdings, ExecutionSettings settings) {
        double price = order.limitPrice() != null ? order.limitPrice() : order.closePrice();

        if (order.direction() == Direction.SELL) {
            if (holdings.quantity() <= 0 || order.amount() <= 0) {
                return RiskDecision.reject(RiskDecision.REASON_NO_HOLDINGS);
            }
            if (order.amount() > holdings.quantity() + TOLERANCE) {
                return RiskDecision.reject(RiskDecision.REASON_SELL_EXCEEDS_HOLDINGS);
            }
            return RiskDecision.approve();
        }

        double feeRate = order.limitPrice() != null ? settings.makerFee() : settings.takerFee();
        double cost = order.amount() * price;
        double fee = cost * feeRate;
        if (cost + fee > holdings.remainingFunds() + TOLERANCE) {
            return RiskDecision.reject(RiskDecision.REASON_INSUFFICIENT_FUNDS);
        }

        double ratio = settings.maximumHoldingsRatio() > 0 ? settings.maximumHoldingsRatio() : maximumHoldingsRatio;
        if (ratio > 0) {
            double equity = holdings.totalValue(price);
            double exposure = equity > 0 ? (holdings.quantity() + order.amount()) * price / equity : 1;
            if (exposure > ratio + TOLERANCE) {
                return RiskDecision.reject(RiskDecision.REASON_EXPOSURE_LIMIT);
            }
        }
        return RiskDecision.approve();
    }
}
