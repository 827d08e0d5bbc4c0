package org.nowstart.backtester.event;

import java.time.Instant;
import org.nowstart.backtester.data.dto.PairKey;

/**
 * Unit of work flowing through the event queue. Implementations are immutable.
 */
public interface BacktestEvent {

    PairKey key();

    Instant timestamp();
}
