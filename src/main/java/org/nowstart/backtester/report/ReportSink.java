package org.nowstart.backtester.report;

public interface ReportSink {

    void publish(BacktestReport report);
}
