package org.nowstart.backtester.runner;

import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.config.BacktestConfig;
import org.nowstart.backtester.data.config.BacktestConfigLoader;
import org.nowstart.backtester.data.property.BacktestProperties;
import org.nowstart.backtester.engine.Backtest;
import org.nowstart.backtester.engine.BacktestFactory;
import org.nowstart.backtester.exchange.HostEngine;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestRunner implements ApplicationRunner {

    private final BacktestProperties backtestProperties;
    private final BacktestConfigLoader backtestConfigLoader;
    private final BacktestFactory backtestFactory;
    private final HostEngine hostEngine;

    private volatile Backtest active;

    @Override
    public void run(ApplicationArguments args) {
        if (!backtestProperties.enabled()) {
            log.info("backtester.enabled=false; pass --backtester.enabled=true to run");
            return;
        }
        if (backtestProperties.configPath().isBlank()) {
            throw new IllegalStateException("backtester.config-path is required when backtester.enabled=true");
        }

        logSection("BACKTEST START");
        log.info("[Overview] config={} reportOutput={}",
                backtestProperties.configPath(), backtestProperties.reportOutputPath());

        BacktestConfig config = backtestConfigLoader.load(Path.of(backtestProperties.configPath()));
        Backtest backtest = backtestFactory.newFromConfig(
                config,
                backtestProperties.configPath(),
                backtestProperties.reportOutputPath(),
                hostEngine
        );
        active = backtest;
        try {
            backtest.run();
            log.info("[Overview] state={} events={}", backtest.getState(), backtest.getProcessedEvents());
        } finally {
            active = null;
        }
        logSection("BACKTEST END");
    }

    @PreDestroy
    public void stop() {
        Backtest backtest = active;
        if (backtest != null) {
            backtest.stop();
        }
    }

    private void logSection(String title) {
        log.info("==================== {} ====================", title);
    }
}
