package org.nowstart.backtester.portfolio.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.nowstart.backtester.support.Fixtures.BTC_USDT;
import static org.nowstart.backtester.support.Fixtures.START;

import org.junit.jupiter.api.Test;
import org.nowstart.backtester.data.dto.ExecutionSettings;
import org.nowstart.backtester.data.dto.MinMax;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.data.type.OrderType;
import org.nowstart.backtester.event.FillEvent;
import org.nowstart.backtester.event.OrderEvent;
import org.nowstart.backtester.portfolio.Holdings;

class DefaultRiskTest {

    private final DefaultRisk risk = new DefaultRisk();

    @Test
    void evaluate_rejectsSellWithoutHoldings() {
        RiskDecision decision = risk.evaluate(order(Direction.SELL, 0), Holdings.initial(BTC_USDT, 1000),
                ExecutionSettings.DEFAULT);

        assertThat(decision.approved()).isFalse();
        assertThat(decision.reason()).isEqualTo(RiskDecision.REASON_NO_HOLDINGS);
    }

    @Test
    void evaluate_rejectsSellAboveHoldings() {
        RiskDecision decision = risk.evaluate(order(Direction.SELL, 3), holding(2), ExecutionSettings.DEFAULT);

        assertThat(decision.reason()).isEqualTo(RiskDecision.REASON_SELL_EXCEEDS_HOLDINGS);
    }

    @Test
    void evaluate_rejectsBuyWhenFeeExceedsFunds() {
        ExecutionSettings fees = new ExecutionSettings(0, 0.5, MinMax.NONE, MinMax.NONE, 0);

        RiskDecision decision = risk.evaluate(order(Direction.BUY, 10), Holdings.initial(BTC_USDT, 1000), fees);

        assertThat(decision.reason()).isEqualTo(RiskDecision.REASON_INSUFFICIENT_FUNDS);
    }

    @Test
    void evaluate_pairRatioOverridesDefault() {
        DefaultRisk loose = new DefaultRisk(1);
        ExecutionSettings tight = new ExecutionSettings(0, 0, MinMax.NONE, MinMax.NONE, 0.5);

        assertThat(loose.evaluate(order(Direction.BUY, 6), Holdings.initial(BTC_USDT, 1000), tight).reason())
                .isEqualTo(RiskDecision.REASON_EXPOSURE_LIMIT);
        assertThat(loose.evaluate(order(Direction.BUY, 5), Holdings.initial(BTC_USDT, 1000), tight).approved())
                .isTrue();
    }

    @Test
    void constructor_rejectsRatioOutsideUnitInterval() {
        assertThatThrownBy(() -> new DefaultRisk(1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    private static OrderEvent order(Direction direction, double amount) {
        return new OrderEvent(BTC_USDT, START, direction, amount, OrderType.MARKET, null, 100, "test");
    }

    private static Holdings holding(double quantity) {
        return Holdings.initial(BTC_USDT, 1000).apply(FillEvent.filled(order(Direction.BUY, quantity), 100, 0));
    }
}
