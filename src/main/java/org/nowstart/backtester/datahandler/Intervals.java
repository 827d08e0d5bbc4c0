package org.nowstart.backtester.datahandler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;

public final class Intervals {

    public static final List<Duration> SUPPORTED = List.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(3),
            Duration.ofMinutes(5),
            Duration.ofMinutes(10),
            Duration.ofMinutes(15),
            Duration.ofMinutes(30),
            Duration.ofHours(1),
            Duration.ofHours(2),
            Duration.ofHours(4),
            Duration.ofHours(6),
            Duration.ofHours(8),
            Duration.ofHours(12),
            Duration.ofDays(1),
            Duration.ofDays(3),
            Duration.ofDays(7)
    );

    private Intervals() {
    }

    public static boolean isSupported(Duration interval) {
        return interval != null && SUPPORTED.contains(interval);
    }

    public static Duration requireSupported(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new BacktestException(ErrorCode.INTERVAL_UNSET, "candle interval unset");
        }
        if (!isSupported(interval)) {
            throw new BacktestException(ErrorCode.INTERVAL_UNSET, "unsupported candle interval: " + interval);
        }
        return interval;
    }

    public static Instant truncate(Instant timestamp, Duration interval) {
        long seconds = interval.getSeconds();
        long epoch = timestamp.getEpochSecond();
        return Instant.ofEpochSecond(Math.floorDiv(epoch, seconds) * seconds);
    }
}
