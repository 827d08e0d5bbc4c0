package org.nowstart.backtester.datahandler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.engine.StopSignal;
import org.nowstart.backtester.event.DataEvent;
import org.nowstart.backtester.exchange.ExchangeAdapter;

/**
 * Polls the exchange for the latest candle once per interval until stopped.
 * {@link #next()} blocks on the stop signal between polls. Only the most recent
 * {@link #MAX_HISTORY} candles are retained.
 */
@Slf4j
public class LiveDataHandler implements DataHandler {

    public static final int MAX_HISTORY = 1_000;

    private final PairKey key;
    private final Duration interval;
    private final Duration pollInterval;
    private final ExchangeAdapter exchange;
    private final StopSignal stopSignal;
    private final Runnable onClose;
    private final Deque<OhlcvCandle> history = new ArrayDeque<>();
    private final Set<Instant> timestamps = new HashSet<>();
    private DataEvent latest;
    private boolean exhausted;
    private boolean closed;

    public LiveDataHandler(PairKey key, Duration interval, ExchangeAdapter exchange, StopSignal stopSignal) {
        this(key, interval, interval, exchange, stopSignal, () -> {
        });
    }

    public LiveDataHandler(
            PairKey key,
            Duration interval,
            Duration pollInterval,
            ExchangeAdapter exchange,
            StopSignal stopSignal
    ) {
        this(key, interval, pollInterval, exchange, stopSignal, () -> {
        });
    }

    public LiveDataHandler(
            PairKey key,
            Duration interval,
            Duration pollInterval,
            ExchangeAdapter exchange,
            StopSignal stopSignal,
            Runnable onClose
    ) {
        this.key = key;
        this.interval = interval;
        this.pollInterval = pollInterval;
        this.exchange = exchange;
        this.stopSignal = stopSignal;
        this.onClose = onClose;
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
        return timestamps.contains(timestamp);
    }

    @Override
    public Optional<DataEvent> next() {
        while (!exhausted) {
            if (stopSignal.isStopped()) {
                exhausted = true;
                break;
            }

            Optional<OhlcvCandle> candle = poll();
            if (candle.isPresent() && isNewer(candle.get())) {
                remember(candle.get());
                latest = DataEvent.of(key, interval, candle.get());
                return Optional.of(latest);
            }

            if (stopSignal.await(pollInterval)) {
                exhausted = true;
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean isExhausted() {
        return exhausted;
    }

    @Override
    public Optional<DataEvent> latest() {
        return Optional.ofNullable(latest);
    }

    @Override
    public List<OhlcvCandle> history() {
        return List.copyOf(history);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        onClose.run();
    }

    private void remember(OhlcvCandle candle) {
        history.addLast(candle);
        timestamps.add(candle.timestamp());
        if (history.size() > MAX_HISTORY) {
            timestamps.remove(history.removeFirst().timestamp());
        }
    }

    private Optional<OhlcvCandle> poll() {
        try {
            return exchange.fetchLatestCandle(key.pair(), key.asset(), interval);
        } catch (RuntimeException e) {
            log.warn("event=live_poll_failed key={} reason={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isNewer(OhlcvCandle candle) {
        return history.isEmpty() || candle.timestamp().isAfter(history.peekLast().timestamp());
    }
}
