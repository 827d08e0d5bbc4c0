package org.nowstart.backtester.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.RunState;
import org.nowstart.backtester.datahandler.DataHandler;
import org.nowstart.backtester.datahandler.DataHandlerPerCurrency;
import org.nowstart.backtester.event.BacktestEvent;
import org.nowstart.backtester.event.DataEvent;
import org.nowstart.backtester.event.EventQueue;
import org.nowstart.backtester.event.FillEvent;
import org.nowstart.backtester.event.OrderEvent;
import org.nowstart.backtester.event.SignalEvent;
import org.nowstart.backtester.exchange.HostEngine;
import org.nowstart.backtester.exchange.PaperExecutionService;
import org.nowstart.backtester.portfolio.Holdings;
import org.nowstart.backtester.portfolio.Portfolio;
import org.nowstart.backtester.report.BacktestReport;
import org.nowstart.backtester.report.ReportSink;
import org.nowstart.backtester.statistics.EquitySnapshot;
import org.nowstart.backtester.statistics.Statistic;
import org.nowstart.backtester.statistics.StatisticsSummary;
import org.nowstart.backtester.strategy.Strategy;
import org.nowstart.backtester.strategy.StrategyInput;

/**
 * Single-threaded event loop driving data, strategy, portfolio, simulated exchange and statistics.
 *
 * <p>Each data event produces exactly one statistics point: either the strategy holds, or the
 * signal ends in a fill (filled or rejected). {@link #stop()} may be called from any thread.
 */
@Slf4j
@Getter
public class Backtest {

    private HostEngine hostEngine;
    private DataHandlerPerCurrency datas;
    private Strategy strategy;
    private Portfolio portfolio;
    private PaperExecutionService exchange;
    private Statistic statistic;
    private EventQueue eventQueue;
    private ReportSink reportSink;
    private StopSignal stopSignal;
    private String configPath;
    private volatile RunState state;
    private long processedEvents;

    @Getter(AccessLevel.NONE)
    private final List<DataEvent> pendingBatch = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private int expectedBatchSize;

    public Backtest() {
        this.state = RunState.UNCONFIGURED;
    }

    @Builder
    private Backtest(
            HostEngine hostEngine,
            DataHandlerPerCurrency datas,
            Strategy strategy,
            Portfolio portfolio,
            PaperExecutionService exchange,
            Statistic statistic,
            EventQueue eventQueue,
            ReportSink reportSink,
            StopSignal stopSignal,
            String configPath
    ) {
        this.hostEngine = hostEngine;
        this.datas = datas;
        this.strategy = strategy;
        this.portfolio = portfolio;
        this.exchange = exchange;
        this.statistic = statistic;
        this.eventQueue = eventQueue == null ? new EventQueue() : eventQueue;
        this.reportSink = reportSink;
        this.stopSignal = stopSignal == null ? new StopSignal() : stopSignal;
        this.configPath = configPath;
        this.state = RunState.CREATED;
    }

    public void run() {
        if (state != RunState.CREATED) {
            throw new IllegalStateException("backtest can only run from CREATED. state=" + state);
        }
        requireComponents();
        state = RunState.RUNNING;
        log.info("[Backtest][RUN] start strategy={} pairs={} simultaneous={}",
                strategy.name(), datas.size(), strategy.usingSimultaneousProcessing());

        try {
            while (true) {
                if (stopSignal.isStopped()) {
                    finishStopped();
                    return;
                }

                Optional<BacktestEvent> next = eventQueue.pop();
                if (next.isEmpty()) {
                    if (pullDataEvents() > 0) {
                        continue;
                    }
                    if (stopSignal.isStopped()) {
                        finishStopped();
                        return;
                    }
                    break;
                }

                processedEvents++;
                handleEvent(next.get());
            }
            complete();
        } catch (BacktestException e) {
            fail(e);
            throw e;
        } catch (RuntimeException e) {
            fail(e);
            throw new BacktestException(ErrorCode.RUN_FAILED, "backtest run failed: " + e.getMessage(), e);
        } finally {
            datas.closeAll();
        }
    }

    /**
     * Requests the run loop to stop. Safe to call repeatedly, before run, or after reset.
     */
    public void stop() {
        StopSignal signal = stopSignal;
        if (signal == null || signal.isStopped()) {
            return;
        }
        signal.trigger();
        log.info("[Backtest][RUN] stop requested state={}", state);
    }

    public void reset() {
        hostEngine = null;
        datas = null;
        strategy = null;
        portfolio = null;
        exchange = null;
        statistic = null;
        eventQueue = null;
        reportSink = null;
        stopSignal = null;
        configPath = null;
        processedEvents = 0;
        pendingBatch.clear();
        expectedBatchSize = 0;
        state = RunState.UNCONFIGURED;
    }

    private void requireComponents() {
        if (datas == null || strategy == null || portfolio == null || exchange == null || statistic == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS,
                    "backtest requires data, strategy, portfolio, exchange and statistics");
        }
    }

    private int pullDataEvents() {
        int pulled = 0;
        for (DataHandler handler : datas.handlers()) {
            if (handler.isExhausted()) {
                continue;
            }
            Optional<DataEvent> event = handler.next();
            if (event.isPresent()) {
                eventQueue.push(event.get());
                pulled++;
            }
        }
        pendingBatch.clear();
        expectedBatchSize = pulled;
        return pulled;
    }

    private void handleEvent(BacktestEvent event) {
        if (event instanceof DataEvent data) {
            onData(data);
        } else if (event instanceof SignalEvent signal) {
            onSignal(signal);
        } else if (event instanceof OrderEvent order) {
            eventQueue.push(exchange.executeOrder(order, latestData(order.key())));
        } else if (event instanceof FillEvent fill) {
            onFill(fill);
        } else {
            throw new BacktestException(ErrorCode.RUN_FAILED, "unknown event type: " + event.getClass().getName());
        }
    }

    private void onData(DataEvent data) {
        if (!strategy.usingSimultaneousProcessing()) {
            pushSignal(strategy.onSignal(inputFor(data.key())), data);
            return;
        }

        pendingBatch.add(data);
        if (pendingBatch.size() < expectedBatchSize) {
            return;
        }
        List<StrategyInput> inputs = pendingBatch.stream().map(event -> inputFor(event.key())).toList();
        List<SignalEvent> signals = strategy.onSimultaneousSignals(inputs);
        if (signals == null || signals.size() != inputs.size()) {
            throw new BacktestException(ErrorCode.INVALID_SIGNAL, "expected " + inputs.size()
                    + " signals from " + strategy.name() + " but got " + (signals == null ? 0 : signals.size()));
        }
        for (int i = 0; i < signals.size(); i++) {
            pushSignal(signals.get(i), pendingBatch.get(i));
        }
        pendingBatch.clear();
    }

    private void pushSignal(SignalEvent signal, DataEvent data) {
        if (signal == null || !signal.key().equals(data.key()) || !signal.timestamp().equals(data.timestamp())) {
            throw new BacktestException(ErrorCode.INVALID_SIGNAL,
                    "signal does not match data event. key=" + data.key() + ", ts=" + data.timestamp());
        }
        eventQueue.push(signal);
    }

    private void onSignal(SignalEvent signal) {
        DataEvent data = latestData(signal.key());
        Optional<BacktestEvent> next = portfolio.onSignal(signal, data);
        if (next.isPresent()) {
            eventQueue.push(next.get());
            return;
        }
        statistic.update(EquitySnapshot.ofHold(data, portfolio.viewHoldings(signal.key()), signal));
    }

    private void onFill(FillEvent fill) {
        Holdings holdings = portfolio.onFill(fill);
        statistic.update(EquitySnapshot.ofFill(latestData(fill.key()), holdings, fill));
    }

    private StrategyInput inputFor(PairKey key) {
        return new StrategyInput(datas.getDataForCurrency(key), portfolio.viewHoldings(key));
    }

    private DataEvent latestData(PairKey key) {
        return datas.getDataForCurrency(key).latest().orElseThrow(() -> new BacktestException(
                ErrorCode.INVALID_SIGNAL, "no data event available for " + key));
    }

    private void complete() {
        StatisticsSummary summary = statistic.calculateAll();
        if (reportSink != null) {
            reportSink.publish(new BacktestReport(strategy.name(), configPath, RunState.COMPLETED, processedEvents,
                    summary));
        }
        statistic.markFinalised();
        state = RunState.COMPLETED;
        log.info("[Backtest][RUN] completed events={} equityPoints={} return={}",
                processedEvents, statistic.equityPoints(), summary.totalReturnPct());
    }

    private void finishStopped() {
        state = RunState.STOPPED;
        log.info("[Backtest][RUN] stopped events={} equityPoints={}", processedEvents, statistic.equityPoints());
    }

    private void fail(RuntimeException e) {
        state = RunState.FAILED;
        log.error("[Backtest][RUN] failed events={} reason={}", processedEvents, e.getMessage(), e);
    }
}
