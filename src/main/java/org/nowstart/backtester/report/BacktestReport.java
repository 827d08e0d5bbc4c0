package org.nowstart.backtester.report;

import org.nowstart.backtester.data.type.RunState;
import org.nowstart.backtester.statistics.StatisticsSummary;

public record BacktestReport(
        String strategyName,
        String configPath,
        RunState state,
        long processedEvents,
        StatisticsSummary summary
) {
}
