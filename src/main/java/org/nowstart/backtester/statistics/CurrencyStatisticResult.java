package org.nowstart.backtester.statistics;

import java.time.Instant;
import org.nowstart.backtester.data.dto.PairKey;

public record CurrencyStatisticResult(
        PairKey key,
        int equityPoints,
        Instant firstTimestamp,
        Instant lastTimestamp,
        double initialFunds,
        double finalValue,
        double totalReturnPct,
        double marketMovementPct,
        double maxDrawdownPct,
        Instant drawdownPeakAt,
        Instant drawdownTroughAt,
        double sharpeRatio,
        int buyOrders,
        int sellOrders,
        int rejectedOrders,
        int holdSignals,
        int closedTrades,
        double winRatePct,
        double totalFees
) {
}
