package org.nowstart.backtester.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.entity.Candle;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.property.BacktestProperties;
import org.nowstart.backtester.repository.CandleRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseCandleSource {

    private final CandleRepository candleRepository;
    private final BacktestProperties backtestProperties;

    /**
     * Candles with {@code start <= ts < end}, or {@code ts <= end} when {@code inclusiveEnd}.
     */
    @Transactional(readOnly = true)
    public List<OhlcvCandle> load(PairKey key, Duration interval, Instant start, Instant end, boolean inclusiveEnd) {
        if (key == null || interval == null || start == null || end == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS,
                    "exchange, base, quote, asset, interval, start & end cannot be empty");
        }
        if (!backtestProperties.databaseEnabled()) {
            throw new BacktestException(ErrorCode.DATABASE_DISABLED);
        }

        List<Candle> rows = candleRepository
                .findByIdExchangeAndIdBaseAndIdQuoteAndIdAssetAndIdIntervalSecondsAndIdTsBetweenOrderByIdTsAsc(
                        key.exchange(),
                        key.pair().base(),
                        key.pair().quote(),
                        key.asset().value(),
                        interval.getSeconds(),
                        start,
                        end
                );
        List<OhlcvCandle> candles = rows.stream()
                .filter(row -> inclusiveEnd || row.getId().ts().isBefore(end))
                .map(Candle::toOhlcv)
                .toList();
        log.info("[Backtest][DATA] database rows={} key={} range={} -> {}", candles.size(), key, start, end);
        return candles;
    }
}
