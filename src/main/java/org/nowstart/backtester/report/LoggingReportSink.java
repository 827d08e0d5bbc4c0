package org.nowstart.backtester.report;

import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.statistics.CurrencyStatisticResult;
import org.nowstart.backtester.statistics.StatisticsSummary;

@Slf4j
public class LoggingReportSink implements ReportSink {

    @Override
    public void publish(BacktestReport report) {
        StatisticsSummary summary = report.summary();
        log.info("==================== REPORT ====================");
        log.info("[Overview] strategy={} config={} state={} events={}",
                report.strategyName(), report.configPath(), report.state(), report.processedEvents());
        for (CurrencyStatisticResult pair : summary.pairs()) {
            log.info("[{}] range={} -> {} points={} initial={} final={} return={} market={} mdd={} sharpe={} "
                            + "buys={} sells={} rejected={} holds={} trades={} winRate={} fees={}",
                    pair.key(),
                    pair.firstTimestamp(),
                    pair.lastTimestamp(),
                    pair.equityPoints(),
                    pair.initialFunds(),
                    pair.finalValue(),
                    formatPercent(pair.totalReturnPct()),
                    formatPercent(pair.marketMovementPct()),
                    formatPercent(pair.maxDrawdownPct()),
                    String.format(Locale.ROOT, "%.4f", pair.sharpeRatio()),
                    pair.buyOrders(),
                    pair.sellOrders(),
                    pair.rejectedOrders(),
                    pair.holdSignals(),
                    pair.closedTrades(),
                    formatPercent(pair.winRatePct()),
                    pair.totalFees());
        }
        log.info("[TOTAL] initial={} final={} return={} worstMdd={} orders={} rejected={} trades={} winRate={}",
                summary.totalInitialFunds(),
                summary.totalFinalValue(),
                formatPercent(summary.totalReturnPct()),
                formatPercent(summary.worstMaxDrawdownPct()),
                summary.totalOrders(),
                summary.rejectedOrders(),
                summary.closedTrades(),
                formatPercent(summary.winRatePct()));
    }

    private String formatPercent(double pct) {
        if (!Double.isFinite(pct)) {
            return "n/a";
        }
        return String.format(Locale.ROOT, "%.2f%%", pct);
    }
}
