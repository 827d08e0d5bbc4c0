package org.nowstart.backtester.exchange;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.CredentialsValidator;
import org.nowstart.backtester.data.dto.CurrencyPair;
import org.nowstart.backtester.data.dto.ExchangeCredentials;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.dto.UpbitCandleResponse;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.AssetType;
import org.nowstart.backtester.repository.UpbitFeignClient;
import org.nowstart.backtester.service.auth.UpbitCredentialsStore;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class UpbitExchangeAdapter implements ExchangeAdapter {

    public static final String NAME = "upbit";

    private static final int MAX_BATCH = 200;
    private static final List<Integer> MINUTE_UNITS = List.of(1, 3, 5, 10, 15, 30, 60, 240);
    private static final CredentialsValidator VALIDATOR = new CredentialsValidator(true, true, false, false, false);

    private final UpbitFeignClient upbitFeignClient;
    private final UpbitCredentialsStore upbitCredentialsStore;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExchangeCredentials getCredentials() {
        return upbitCredentialsStore.get();
    }

    @Override
    public void setCredentials(ExchangeCredentials credentials) {
        upbitCredentialsStore.set(credentials);
    }

    @Override
    public CredentialsValidator credentialsValidator() {
        return VALIDATOR;
    }

    @Override
    public List<OhlcvCandle> fetchHistoricCandles(
            CurrencyPair pair,
            AssetType asset,
            Instant start,
            Instant end,
            Duration interval
    ) {
        requireSpot(asset);
        String market = toMarket(pair);
        Map<Instant, OhlcvCandle> dedup = new HashMap<>();
        Instant cursor = end;

        while (true) {
            List<UpbitCandleResponse> batch = requestBatch(market, interval, cursor, MAX_BATCH);
            if (batch == null || batch.isEmpty()) {
                break;
            }

            Instant oldest = null;
            for (UpbitCandleResponse response : batch) {
                OhlcvCandle candle = toCandle(response);
                if (oldest == null || candle.timestamp().isBefore(oldest)) {
                    oldest = candle.timestamp();
                }
                if (candle.timestamp().isBefore(start) || !candle.timestamp().isBefore(end)) {
                    continue;
                }
                dedup.put(candle.timestamp(), candle);
            }

            if (batch.size() < MAX_BATCH || !oldest.isAfter(start) || !oldest.isBefore(cursor)) {
                break;
            }
            cursor = oldest;
        }

        List<OhlcvCandle> out = new ArrayList<>(dedup.values());
        out.sort(Comparator.comparing(OhlcvCandle::timestamp));
        log.info("[Backtest][DATA] upbit market={} interval={} candles={} range={} -> {}",
                market, interval, out.size(), start, end);
        return out;
    }

    /**
     * Latest closed candle. Upbit returns the in-progress candle first, so the second one is used.
     */
    @Override
    public Optional<OhlcvCandle> fetchLatestCandle(CurrencyPair pair, AssetType asset, Duration interval) {
        requireSpot(asset);
        List<UpbitCandleResponse> batch = requestBatch(toMarket(pair), interval, null, 2);
        if (batch == null || batch.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(toCandle(batch.get(1)));
    }

    private List<UpbitCandleResponse> requestBatch(String market, Duration interval, Instant to, int count) {
        String toParam = to == null ? null : to.toString();
        long minutes = interval.toMinutes();
        if (interval.equals(Duration.ofDays(1))) {
            return upbitFeignClient.getDayCandles(market, toParam, count);
        }
        if (interval.equals(Duration.ofDays(7))) {
            return upbitFeignClient.getWeekCandles(market, toParam, count);
        }
        if (minutes > 0 && minutes <= Integer.MAX_VALUE && MINUTE_UNITS.contains((int) minutes)
                && interval.equals(Duration.ofMinutes(minutes))) {
            return upbitFeignClient.getMinuteCandles((int) minutes, market, toParam, count);
        }
        throw new BacktestException(ErrorCode.INTERVAL_UNSET, "upbit does not provide candles for interval " + interval);
    }

    static String toMarket(CurrencyPair pair) {
        return pair.quote() + "-" + pair.base();
    }

    private static OhlcvCandle toCandle(UpbitCandleResponse response) {
        return new OhlcvCandle(
                parseTs(response.candle_date_time_utc()),
                response.opening_price().doubleValue(),
                response.high_price().doubleValue(),
                response.low_price().doubleValue(),
                response.trade_price().doubleValue(),
                response.candle_acc_trade_volume() == null ? 0.0 : response.candle_acc_trade_volume().doubleValue()
        );
    }

    private static Instant parseTs(String raw) {
        String ts = raw.trim();
        if (ts.endsWith("Z") || ts.endsWith("z")) {
            return Instant.parse(ts.substring(0, ts.length() - 1) + "Z");
        }
        return Instant.parse(ts + "Z");
    }

    private static void requireSpot(AssetType asset) {
        if (asset != AssetType.SPOT) {
            throw new BacktestException(ErrorCode.UNSET_ASSET, "upbit supports spot only. asset=" + asset);
        }
    }
}
