package org.nowstart.backtester.datahandler;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.event.DataEvent;

public class KlineDataHandler implements DataHandler {

    private final PairKey key;
    private final Duration interval;
    private final List<OhlcvCandle> candles;
    @Getter
    private final DataRange range;
    private int offset;
    private DataEvent latest;

    public KlineDataHandler(PairKey key, Duration interval, List<OhlcvCandle> candles, DataRange range) {
        if (key == null || interval == null || candles == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "key, interval and candles are required");
        }
        this.key = key;
        this.interval = interval;
        this.candles = List.copyOf(candles);
        requireAscending(this.candles);
        this.range = range == null ? rangeOf(this.candles, interval) : range;
        if (range != null) {
            range.markHasData(this.candles);
        }
    }

    public KlineDataHandler(PairKey key, Duration interval, List<OhlcvCandle> candles) {
        this(key, interval, candles, null);
    }

    @Override
    public PairKey key() {
        return key;
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public boolean hasDataAtTime(Instant timestamp) {
        return range != null && range.hasDataAtTime(timestamp);
    }

    @Override
    public Optional<DataEvent> next() {
        if (isExhausted()) {
            return Optional.empty();
        }
        latest = DataEvent.of(key, interval, candles.get(offset++));
        return Optional.of(latest);
    }

    @Override
    public boolean isExhausted() {
        return offset >= candles.size();
    }

    @Override
    public Optional<DataEvent> latest() {
        return Optional.ofNullable(latest);
    }

    @Override
    public List<OhlcvCandle> history() {
        return Collections.unmodifiableList(candles.subList(0, offset));
    }

    public int size() {
        return candles.size();
    }

    private static void requireAscending(List<OhlcvCandle> candles) {
        for (int i = 1; i < candles.size(); i++) {
            if (!candles.get(i).timestamp().isAfter(candles.get(i - 1).timestamp())) {
                throw new BacktestException(ErrorCode.OUT_OF_ORDER_EVENT,
                        "candles must be strictly ascending. index=" + i + ", ts=" + candles.get(i).timestamp());
            }
        }
    }

    private static DataRange rangeOf(List<OhlcvCandle> candles, Duration interval) {
        if (candles.isEmpty()) {
            return null;
        }
        Instant first = candles.get(0).timestamp();
        Instant last = candles.get(candles.size() - 1).timestamp();
        DataRange range = DataRange.of(first, last.plus(interval), interval, false);
        range.markHasData(candles);
        return range;
    }
}
