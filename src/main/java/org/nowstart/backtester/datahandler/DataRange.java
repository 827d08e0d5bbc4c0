package org.nowstart.backtester.datahandler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.Getter;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;

/**
 * Interval slots between start and end, each flagged with whether a candle was retrieved for it.
 * Start is aligned down to the interval boundary.
 */
@Getter
public final class DataRange {

    private static final long MAX_SLOTS = 5_000_000L;

    private final Instant start;
    private final Instant end;
    private final Duration interval;
    private final boolean inclusiveEnd;
    private final boolean[] hasData;

    private DataRange(Instant start, Instant end, Duration interval, boolean inclusiveEnd, int slotCount) {
        this.start = start;
        this.end = end;
        this.interval = interval;
        this.inclusiveEnd = inclusiveEnd;
        this.hasData = new boolean[slotCount];
    }

    public static DataRange of(Instant start, Instant end, Duration interval, boolean inclusiveEnd) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new BacktestException(ErrorCode.START_END_UNSET,
                    "start and end must be set and start must precede end. start=" + start + ", end=" + end);
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new BacktestException(ErrorCode.INTERVAL_UNSET, "candle interval unset");
        }

        Instant alignedStart = Intervals.truncate(start, interval);
        long span = Duration.between(alignedStart, end).getSeconds();
        long step = interval.getSeconds();
        long slots = inclusiveEnd ? span / step + 1 : (span + step - 1) / step;
        if (slots > MAX_SLOTS) {
            throw new BacktestException(ErrorCode.START_END_UNSET,
                    "date range too large for interval. slots=" + slots);
        }
        return new DataRange(alignedStart, end, interval, inclusiveEnd, (int) slots);
    }

    public int slotCount() {
        return hasData.length;
    }

    public Instant slotTime(int index) {
        return start.plusSeconds(index * interval.getSeconds());
    }

    public void markHasData(Collection<OhlcvCandle> candles) {
        for (OhlcvCandle candle : candles) {
            int index = indexOf(candle.timestamp());
            if (index >= 0) {
                hasData[index] = true;
            }
        }
    }

    public boolean hasDataAtTime(Instant timestamp) {
        int index = indexOf(timestamp);
        return index >= 0 && hasData[index];
    }

    public boolean contains(Instant timestamp) {
        return indexOf(timestamp) >= 0;
    }

    public List<Instant> missingSlots() {
        List<Instant> missing = new ArrayList<>();
        for (int i = 0; i < hasData.length; i++) {
            if (!hasData[i]) {
                missing.add(slotTime(i));
            }
        }
        return missing;
    }

    public boolean isFullyRetrieved() {
        for (boolean flag : hasData) {
            if (!flag) {
                return false;
            }
        }
        return true;
    }

    private int indexOf(Instant timestamp) {
        if (timestamp == null || timestamp.isBefore(start)) {
            return -1;
        }
        long offset = Duration.between(start, timestamp).getSeconds();
        long step = interval.getSeconds();
        if (offset % step != 0) {
            return -1;
        }
        long index = offset / step;
        return index < hasData.length ? (int) index : -1;
    }
}
