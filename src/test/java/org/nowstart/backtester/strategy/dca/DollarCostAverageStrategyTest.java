package org.nowstart.backtester.strategy.dca;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.nowstart.backtester.support.Fixtures.BTC_USDT;
import static org.nowstart.backtester.support.Fixtures.ETH_USDT;
import static org.nowstart.backtester.support.Fixtures.FIFTEEN_MINUTES;
import static org.nowstart.backtester.support.Fixtures.START;
import static org.nowstart.backtester.support.Fixtures.candles;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.datahandler.KlineDataHandler;
import org.nowstart.backtester.event.SignalEvent;
import org.nowstart.backtester.portfolio.Holdings;
import org.nowstart.backtester.strategy.SettingValue;
import org.nowstart.backtester.strategy.StrategyInput;

class DollarCostAverageStrategyTest {

    private final DollarCostAverageStrategy strategy = new DollarCostAverageStrategy();

    @Test
    void onSignal_alwaysBuysAtLatestCandle() {
        StrategyInput input = input(new KlineDataHandler(BTC_USDT, FIFTEEN_MINUTES, candles(START, FIFTEEN_MINUTES, 10, 11)));
        input.data().next();

        SignalEvent signal = strategy.onSignal(input);

        assertThat(signal.direction()).isEqualTo(Direction.BUY);
        assertThat(signal.timestamp()).isEqualTo(START);
        assertThat(signal.closePrice()).isEqualTo(10.0);
        assertThat(signal.limitPrice()).isNull();
    }

    @Test
    void onSimultaneousSignals_returnsOneSignalPerInputInOrder() {
        KlineDataHandler btc = new KlineDataHandler(BTC_USDT, FIFTEEN_MINUTES, candles(START, FIFTEEN_MINUTES, 10));
        KlineDataHandler eth = new KlineDataHandler(ETH_USDT, FIFTEEN_MINUTES, candles(START, FIFTEEN_MINUTES, 20));
        btc.next();
        eth.next();

        List<SignalEvent> signals = strategy.onSimultaneousSignals(List.of(input(eth), input(btc)));

        assertThat(signals).extracting(SignalEvent::key).containsExactly(ETH_USDT, BTC_USDT);
        assertThat(signals).extracting(SignalEvent::direction).containsOnly(Direction.BUY);
    }

    @Test
    void onSignal_throwsBeforeAnyData() {
        StrategyInput input = input(new KlineDataHandler(BTC_USDT, FIFTEEN_MINUTES, candles(START, FIFTEEN_MINUTES, 10)));

        assertThatThrownBy(() -> strategy.onSignal(input))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.INVALID_SIGNAL);
    }

    @Test
    void setCustomSettings_isUnsupported() {
        assertThatThrownBy(() -> strategy.setCustomSettings(Map.of("hello", SettingValue.of("moto"))))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.CUSTOM_SETTINGS_UNSUPPORTED);
        assertThat(strategy.supportsSimultaneousProcessing()).isTrue();
        assertThat(strategy.description()).isNotBlank();
    }

    private static StrategyInput input(KlineDataHandler handler) {
        return new StrategyInput(handler, Holdings.initial(handler.key(), 1000));
    }
}
