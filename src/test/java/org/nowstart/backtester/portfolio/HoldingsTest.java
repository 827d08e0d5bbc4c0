package org.nowstart.backtester.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.nowstart.backtester.support.Fixtures.BTC_USDT;
import static org.nowstart.backtester.support.Fixtures.START;

import org.junit.jupiter.api.Test;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.data.type.OrderType;
import org.nowstart.backtester.event.FillEvent;
import org.nowstart.backtester.event.OrderEvent;

class HoldingsTest {

    @Test
    void apply_tracksAverageCostAndRealisedPnl() {
        Holdings holdings = Holdings.initial(BTC_USDT, 1000)
                .apply(fill(Direction.BUY, 2, 100, 0))
                .apply(fill(Direction.BUY, 2, 200, 0));

        assertThat(holdings.quantity()).isEqualTo(4.0);
        assertThat(holdings.averageCost()).isCloseTo(150.0, within(1e-9));
        assertThat(holdings.remainingFunds()).isCloseTo(400.0, within(1e-9));

        Holdings closed = holdings.apply(fill(Direction.SELL, 4, 175, 1));

        assertThat(closed.quantity()).isZero();
        assertThat(closed.averageCost()).isZero();
        assertThat(closed.realisedPnl()).isCloseTo(99.0, within(1e-9));
        assertThat(closed.remainingFunds()).isCloseTo(1099.0, within(1e-9));
        assertThat(closed.totalFees()).isEqualTo(1.0);
        assertThat(closed.totalValue(500)).isCloseTo(1099.0, within(1e-9));
    }

    @Test
    void apply_rejectsBuyBeyondFunds() {
        Holdings holdings = Holdings.initial(BTC_USDT, 100);

        assertThatThrownBy(() -> holdings.apply(fill(Direction.BUY, 2, 100, 0)))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.NEGATIVE_HOLDINGS);
    }

    @Test
    void apply_rejectsSellBeyondQuantity() {
        Holdings holdings = Holdings.initial(BTC_USDT, 100);

        assertThatThrownBy(() -> holdings.apply(fill(Direction.SELL, 1, 100, 0)))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.NEGATIVE_HOLDINGS);
    }

    private static FillEvent fill(Direction direction, double amount, double price, double fee) {
        OrderEvent order = new OrderEvent(BTC_USDT, START, direction, amount, OrderType.MARKET, null, price, "test");
        return FillEvent.filled(order, price, fee);
    }
}
