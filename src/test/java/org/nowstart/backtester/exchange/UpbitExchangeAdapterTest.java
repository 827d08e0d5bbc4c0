package org.nowstart.backtester.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.backtester.data.dto.CurrencyPair;
import org.nowstart.backtester.data.dto.ExchangeCredentials;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.dto.UpbitCandleResponse;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.AssetType;
import org.nowstart.backtester.repository.UpbitFeignClient;
import org.nowstart.backtester.service.auth.UpbitCredentialsStore;

@ExtendWith(MockitoExtension.class)
class UpbitExchangeAdapterTest {

    private static final CurrencyPair BTC_KRW = CurrencyPair.of("BTC", "KRW");
    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private UpbitFeignClient upbitFeignClient;

    @Mock
    private UpbitCredentialsStore upbitCredentialsStore;

    @InjectMocks
    private UpbitExchangeAdapter adapter;

    @Test
    void fetchHistoricCandles_returnsAscendingCandlesWithinRange() {
        Instant end = START.plus(Duration.ofDays(3));
        when(upbitFeignClient.getDayCandles(eq("KRW-BTC"), eq(end.toString()), eq(200))).thenReturn(List.of(
                response("2026-01-03T00:00:00", 103),
                response("2026-01-02T00:00:00", 102),
                response("2026-01-01T00:00:00", 101),
                response("2025-12-31T00:00:00", 100)
        ));

        List<OhlcvCandle> candles = adapter.fetchHistoricCandles(BTC_KRW, AssetType.SPOT, START, end, Duration.ofDays(1));

        assertThat(candles).extracting(OhlcvCandle::close).containsExactly(101.0, 102.0, 103.0);
        assertThat(candles.get(0).timestamp()).isEqualTo(START);
    }

    @Test
    void fetchHistoricCandles_pagesBackwardsUntilStart() {
        Duration interval = Duration.ofMinutes(1);
        Instant end = START.plus(Duration.ofMinutes(300));
        List<UpbitCandleResponse> firstPage = new ArrayList<>();
        for (int i = 299; i >= 100; i--) {
            firstPage.add(response(START.plus(Duration.ofMinutes(i)).toString().replace("Z", ""), i));
        }
        List<UpbitCandleResponse> secondPage = new ArrayList<>();
        for (int i = 99; i >= 0; i--) {
            secondPage.add(response(START.plus(Duration.ofMinutes(i)).toString().replace("Z", ""), i));
        }
        when(upbitFeignClient.getMinuteCandles(1, "KRW-BTC", end.toString(), 200)).thenReturn(firstPage);
        when(upbitFeignClient.getMinuteCandles(1, "KRW-BTC", START.plus(Duration.ofMinutes(100)).toString(), 200))
                .thenReturn(secondPage);

        List<OhlcvCandle> candles = adapter.fetchHistoricCandles(BTC_KRW, AssetType.SPOT, START, end, interval);

        assertThat(candles).hasSize(300);
        assertThat(candles.get(0).timestamp()).isEqualTo(START);
        assertThat(candles.get(299).timestamp()).isEqualTo(START.plus(Duration.ofMinutes(299)));
    }

    @Test
    void fetchLatestCandle_usesLastClosedCandle() {
        when(upbitFeignClient.getMinuteCandles(eq(15), eq("KRW-BTC"), isNull(), eq(2))).thenReturn(List.of(
                response("2026-01-01T00:15:00", 11),
                response("2026-01-01T00:00:00", 10)
        ));

        Optional<OhlcvCandle> latest = adapter.fetchLatestCandle(BTC_KRW, AssetType.SPOT, Duration.ofMinutes(15));

        assertThat(latest).get().extracting(OhlcvCandle::timestamp).isEqualTo(START);
    }

    @Test
    void fetchHistoricCandles_rejectsUnsupportedIntervalAndAsset() {
        assertThatThrownBy(() -> adapter.fetchHistoricCandles(BTC_KRW, AssetType.SPOT, START,
                START.plus(Duration.ofDays(1)), Duration.ofHours(2)))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.INTERVAL_UNSET);
        assertThatThrownBy(() -> adapter.fetchHistoricCandles(BTC_KRW, AssetType.FUTURES, START,
                START.plus(Duration.ofDays(1)), Duration.ofDays(1)))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.UNSET_ASSET);
        verify(upbitFeignClient, never()).getMinuteCandles(anyInt(), anyString(), any(), anyInt());
    }

    @Test
    void validateCredentials_requiresKeyAndSecret() {
        when(upbitCredentialsStore.get()).thenReturn(new ExchangeCredentials("access", "", "", "", ""));

        assertThat(adapter.validateCredentials()).containsExactly("api secret required");
        assertThat(adapter.areCredentialsValid()).isFalse();
        assertThat(UpbitExchangeAdapter.toMarket(BTC_KRW)).isEqualTo("KRW-BTC");
    }

    private static UpbitCandleResponse response(String utc, double close) {
        BigDecimal price = BigDecimal.valueOf(close);
        return new UpbitCandleResponse("KRW-BTC", utc, price, price, price, price, BigDecimal.ONE);
    }
}
