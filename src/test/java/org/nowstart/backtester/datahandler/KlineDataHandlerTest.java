package org.nowstart.backtester.datahandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.nowstart.backtester.support.Fixtures.BTC_USDT;
import static org.nowstart.backtester.support.Fixtures.ETH_USDT;
import static org.nowstart.backtester.support.Fixtures.FIFTEEN_MINUTES;
import static org.nowstart.backtester.support.Fixtures.START;
import static org.nowstart.backtester.support.Fixtures.candle;
import static org.nowstart.backtester.support.Fixtures.candles;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.event.DataEvent;

class KlineDataHandlerTest {

    @Test
    void next_emitsCandlesInOrderUntilExhausted() {
        KlineDataHandler handler = new KlineDataHandler(BTC_USDT, FIFTEEN_MINUTES,
                candles(START, FIFTEEN_MINUTES, 100, 101));

        Optional<DataEvent> first = handler.next();
        Optional<DataEvent> second = handler.next();

        assertThat(first).get().extracting(DataEvent::closePrice).isEqualTo(100.0);
        assertThat(second).get().extracting(DataEvent::timestamp).isEqualTo(START.plus(FIFTEEN_MINUTES));
        assertThat(handler.isExhausted()).isTrue();
        assertThat(handler.next()).isEmpty();
        assertThat(handler.latest()).isEqualTo(second);
        assertThat(handler.history()).hasSize(2);
    }

    @Test
    void history_onlyContainsEmittedCandles() {
        KlineDataHandler handler = new KlineDataHandler(BTC_USDT, FIFTEEN_MINUTES,
                candles(START, FIFTEEN_MINUTES, 100, 101, 102));

        handler.next();

        assertThat(handler.history()).extracting(OhlcvCandle::close).containsExactly(100.0);
        assertThat(handler.latest()).isPresent();
    }

    @Test
    void constructor_rejectsUnorderedCandles() {
        List<OhlcvCandle> unordered = List.of(
                candle(START.plus(FIFTEEN_MINUTES), 1),
                candle(START, 1)
        );

        assertThatThrownBy(() -> new KlineDataHandler(BTC_USDT, FIFTEEN_MINUTES, unordered))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.OUT_OF_ORDER_EVENT);
    }

    @Test
    void hasDataAtTime_usesRangeFlags() {
        KlineDataHandler handler = new KlineDataHandler(BTC_USDT, FIFTEEN_MINUTES, List.of(
                candle(START, 1),
                candle(START.plus(FIFTEEN_MINUTES.multipliedBy(2)), 1)
        ));

        assertThat(handler.hasDataAtTime(START)).isTrue();
        assertThat(handler.hasDataAtTime(START.plus(FIFTEEN_MINUTES))).isFalse();
        assertThat(handler.getRange().missingSlots()).containsExactly(START.plus(FIFTEEN_MINUTES));
    }

    @Test
    void dataHandlerPerCurrency_keepsRegistrationOrder() {
        DataHandlerPerCurrency datas = new DataHandlerPerCurrency();
        KlineDataHandler eth = new KlineDataHandler(ETH_USDT, FIFTEEN_MINUTES, candles(START, FIFTEEN_MINUTES, 10));
        KlineDataHandler btc = new KlineDataHandler(BTC_USDT, FIFTEEN_MINUTES, candles(START, FIFTEEN_MINUTES, 20));

        datas.setDataForCurrency(ETH_USDT, eth);
        datas.setDataForCurrency(BTC_USDT.exchange(), BTC_USDT.asset(), BTC_USDT.pair(), btc);

        assertThat(datas.handlers()).containsExactly(eth, btc);
        assertThat(datas.getDataForCurrency(BTC_USDT)).isSameAs(btc);
        assertThatThrownBy(() -> new DataHandlerPerCurrency().getDataForCurrency(BTC_USDT))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.DATA_UNAVAILABLE);
    }
}
