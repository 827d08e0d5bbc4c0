package org.nowstart.backtester.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.nowstart.backtester.support.Fixtures.BTC_USDT;
import static org.nowstart.backtester.support.Fixtures.ETH_USDT;
import static org.nowstart.backtester.support.Fixtures.FIFTEEN_MINUTES;
import static org.nowstart.backtester.support.Fixtures.START;
import static org.nowstart.backtester.support.Fixtures.candle;

import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nowstart.backtester.data.dto.ExecutionSettings;
import org.nowstart.backtester.data.dto.MinMax;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.data.type.OrderType;
import org.nowstart.backtester.event.BacktestEvent;
import org.nowstart.backtester.event.DataEvent;
import org.nowstart.backtester.event.FillEvent;
import org.nowstart.backtester.event.OrderEvent;
import org.nowstart.backtester.event.SignalEvent;
import org.nowstart.backtester.exchange.PaperExecutionService;
import org.nowstart.backtester.portfolio.risk.DefaultRisk;
import org.nowstart.backtester.portfolio.risk.RiskDecision;
import org.nowstart.backtester.portfolio.size.Size;

class PortfolioTest {

    private Portfolio portfolio;
    private DataEvent data;

    @BeforeEach
    void setUp() {
        portfolio = Portfolio.setup(Size.unbounded(), new DefaultRisk(), 0);
        portfolio.setupCurrencySettingsMap(BTC_USDT, new ExecutionSettings(0.001, 0.002, MinMax.NONE, MinMax.NONE, 0));
        portfolio.setInitialFunds(BTC_USDT, 1000);
        data = DataEvent.of(BTC_USDT, FIFTEEN_MINUTES, candle(START, 100));
    }

    @Test
    void setup_rejectsMissingComponentsAndNegativeRiskFreeRate() {
        assertThatThrownBy(() -> Portfolio.setup(null, new DefaultRisk(), 0))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.NIL_ARGUMENTS);
        assertThatThrownBy(() -> Portfolio.setup(Size.unbounded(), new DefaultRisk(), -0.1))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.INVALID_CURRENCY_SETTINGS);
    }

    @Test
    void setInitialFunds_requiresSettingsAndPositiveFunds() {
        assertThatThrownBy(() -> portfolio.setInitialFunds(ETH_USDT, 100))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.CURRENCY_SETTINGS_NOT_FOUND);
        assertThatThrownBy(() -> portfolio.setInitialFunds(BTC_USDT, 0))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.BAD_INITIAL_FUNDS);
        assertThat(portfolio.getInitialFunds(BTC_USDT)).isEqualTo(1000.0);
    }

    @Test
    void setupCurrencySettingsMap_byComponentsUsesDefaultSettings() {
        portfolio.setupCurrencySettingsMap("Binance", ETH_USDT.asset(), ETH_USDT.pair());

        assertThat(portfolio.getExecutionSettings(ETH_USDT)).isEqualTo(ExecutionSettings.DEFAULT);
        assertThat(portfolio.viewHoldings("binance", ETH_USDT.asset(), ETH_USDT.pair()).quantity()).isZero();
    }

    @Test
    void onSignal_returnsEmptyForHold() {
        assertThat(portfolio.onSignal(SignalEvent.of(data, Direction.HOLD, "wait"), data)).isEmpty();
    }

    @Test
    void onSignal_sizesBuyFromAvailableFunds() {
        Optional<BacktestEvent> result = portfolio.onSignal(SignalEvent.of(data, Direction.BUY, "buy"), data);

        assertThat(result).get().isInstanceOf(OrderEvent.class);
        OrderEvent order = (OrderEvent) result.get();
        assertThat(order.orderType()).isEqualTo(OrderType.MARKET);
        assertThat(order.amount()).isCloseTo(1000 * (1 - 0.002) / 100, within(1e-9));
        assertThat(order.closePrice()).isEqualTo(100.0);
    }

    @Test
    void onSignal_sizesLimitBuyAtLimitPriceSoItPassesFundsCheck() {
        SignalEvent signal = new SignalEvent(BTC_USDT, START, Direction.BUY, 0, 110.0, 100, "limit buy");

        Optional<BacktestEvent> result = portfolio.onSignal(signal, data);

        assertThat(result).get().isInstanceOf(OrderEvent.class);
        OrderEvent order = (OrderEvent) result.get();
        assertThat(order.orderType()).isEqualTo(OrderType.LIMIT);
        assertThat(order.limitPrice()).isEqualTo(110.0);
        assertThat(order.amount()).isCloseTo(1000 * (1 - 0.001) / 110, within(1e-9));

        FillEvent fill = new PaperExecutionService().executeOrder(order, data);
        assertThat(fill.isFilled()).isTrue();
        assertThat(portfolio.onFill(fill).remainingFunds()).isGreaterThan(0);
    }

    @Test
    void onSignal_rejectsSellWithoutHoldings() {
        Optional<BacktestEvent> result = portfolio.onSignal(SignalEvent.of(data, Direction.SELL, "sell"), data);

        assertThat(result).get().isInstanceOf(FillEvent.class);
        FillEvent fill = (FillEvent) result.get();
        assertThat(fill.isFilled()).isFalse();
        assertThat(fill.reason()).isEqualTo(RiskDecision.REASON_NO_HOLDINGS);
    }

    @Test
    void onSignal_rejectsBuyWhenFeeConsumesAllFunds() {
        portfolio.setupCurrencySettingsMap(ETH_USDT, new ExecutionSettings(1337, 1337, MinMax.NONE, MinMax.NONE, 0));
        portfolio.setInitialFunds(ETH_USDT, 1337);
        DataEvent ethData = DataEvent.of(ETH_USDT, FIFTEEN_MINUTES, candle(START, 1337));

        Optional<BacktestEvent> result = portfolio.onSignal(SignalEvent.of(ethData, Direction.BUY, "buy"), ethData);

        assertThat(result).get().isInstanceOf(FillEvent.class);
        assertThat(((FillEvent) result.get()).isFilled()).isFalse();
    }

    @Test
    void onFill_appliesFilledAndIgnoresRejected() {
        OrderEvent order = new OrderEvent(BTC_USDT, START, Direction.BUY, 2, OrderType.MARKET, null, 100, "buy");

        Holdings unchanged = portfolio.onFill(FillEvent.rejected(order, "no"));
        Holdings afterBuy = portfolio.onFill(FillEvent.filled(order, 100, 0.4));

        assertThat(unchanged.quantity()).isZero();
        assertThat(afterBuy.quantity()).isEqualTo(2.0);
        assertThat(afterBuy.remainingFunds()).isCloseTo(799.6, within(1e-9));
        assertThat(portfolio.viewHoldings(BTC_USDT)).isEqualTo(afterBuy);
    }

    @Test
    void viewHoldings_throwsForUnknownPair() {
        assertThatThrownBy(() -> portfolio.viewHoldings(ETH_USDT))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.CURRENCY_SETTINGS_NOT_FOUND);
    }
}
