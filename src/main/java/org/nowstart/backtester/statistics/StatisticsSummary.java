package org.nowstart.backtester.statistics;

import java.util.List;

public record StatisticsSummary(
        List<CurrencyStatisticResult> pairs,
        double totalInitialFunds,
        double totalFinalValue,
        double totalReturnPct,
        double worstMaxDrawdownPct,
        int totalOrders,
        int rejectedOrders,
        int closedTrades,
        double winRatePct
) {
}
