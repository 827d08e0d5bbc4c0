package org.nowstart.backtester.datahandler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.event.DataEvent;

/**
 * Source of market data events for one exchange/asset/pair.
 */
public interface DataHandler {

    PairKey key();

    Duration interval();

    boolean hasDataAtTime(Instant timestamp);

    /**
     * Advances to the next data point. Empty once the handler is exhausted.
     */
    Optional<DataEvent> next();

    boolean isExhausted();

    Optional<DataEvent> latest();

    /**
     * Candles emitted so far, oldest first.
     */
    List<OhlcvCandle> history();

    /**
     * Releases anything the handler changed outside itself. Called once when the run ends.
     */
    default void close() {
    }
}
