package org.nowstart.backtester.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.config.BacktestConfig;
import org.nowstart.backtester.data.config.CurrencySettings;
import org.nowstart.backtester.data.config.DataSettings;
import org.nowstart.backtester.data.config.PortfolioSettings;
import org.nowstart.backtester.data.config.StrategySettings;
import org.nowstart.backtester.data.dto.CurrencyPair;
import org.nowstart.backtester.data.dto.ExecutionSettings;
import org.nowstart.backtester.data.dto.MinMax;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.AssetType;
import org.nowstart.backtester.data.type.DataType;
import org.nowstart.backtester.datahandler.DataHandlerPerCurrency;
import org.nowstart.backtester.datahandler.Intervals;
import org.nowstart.backtester.event.EventQueue;
import org.nowstart.backtester.exchange.ExchangeAdapter;
import org.nowstart.backtester.exchange.HostEngine;
import org.nowstart.backtester.exchange.PaperExecutionService;
import org.nowstart.backtester.portfolio.Portfolio;
import org.nowstart.backtester.portfolio.risk.DefaultRisk;
import org.nowstart.backtester.portfolio.size.Size;
import org.nowstart.backtester.report.JsonFileReportSink;
import org.nowstart.backtester.report.LoggingReportSink;
import org.nowstart.backtester.report.ReportSink;
import org.nowstart.backtester.service.CandleLoaderService;
import org.nowstart.backtester.statistics.Statistic;
import org.nowstart.backtester.strategy.Strategy;
import org.nowstart.backtester.strategy.StrategyRegistry;
import org.springframework.stereotype.Service;

/**
 * Validates a run config and wires a {@link Backtest} in the CREATED state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestFactory {

    private final StrategyRegistry strategyRegistry;
    private final CandleLoaderService candleLoaderService;
    private final ObjectMapper objectMapper;

    public Backtest newFromConfig(
            BacktestConfig config,
            String configPath,
            String reportOutputPath,
            HostEngine hostEngine
    ) {
        List<ResolvedCurrency> currencies = validate(config, hostEngine);
        StrategySettings strategySettings = config.getStrategySettings();
        Strategy strategy = strategyRegistry.loadStrategyByName(
                strategySettings.getName(),
                strategySettings.isSimultaneousSignalProcessing()
        );
        validateSettings(config);

        double riskFreeRate = config.getStatisticSettings() == null ? 0 : config.getStatisticSettings().getRiskFreeRate();
        PortfolioSettings portfolioSettings = config.getPortfolioSettings() == null
                ? new PortfolioSettings(MinMax.NONE, MinMax.NONE, 0)
                : config.getPortfolioSettings();
        Portfolio portfolio = Portfolio.setup(
                new Size(portfolioSettings.getBuySide(), portfolioSettings.getSellSide()),
                new DefaultRisk(portfolioSettings.getMaximumHoldingsRatio()),
                riskFreeRate
        );
        PaperExecutionService exchange = new PaperExecutionService();
        Statistic statistic = new Statistic(riskFreeRate);
        StopSignal stopSignal = new StopSignal();
        DataHandlerPerCurrency datas = new DataHandlerPerCurrency();

        try {
            for (ResolvedCurrency currency : currencies) {
                ExecutionSettings executionSettings = currency.settings().toExecutionSettings();
                portfolio.setupCurrencySettingsMap(currency.key(), executionSettings);
                portfolio.setInitialFunds(currency.key(), currency.settings().getInitialFunds());
                exchange.setCurrencySettings(currency.key(), executionSettings);
                statistic.setupPair(currency.key());
                datas.setDataForCurrency(currency.key(),
                        candleLoaderService.loadData(config, currency.adapter(), currency.key(), stopSignal));
            }
            applyStrategySettings(strategy, strategySettings);
        } catch (RuntimeException e) {
            datas.closeAll();
            throw e;
        }

        log.info("[Backtest][SETUP] nickname={} strategy={} pairs={} config={}",
                config.getNickname(), strategy.name(), currencies.size(), configPath);
        return Backtest.builder()
                .hostEngine(hostEngine)
                .datas(datas)
                .strategy(strategy)
                .portfolio(portfolio)
                .exchange(exchange)
                .statistic(statistic)
                .eventQueue(new EventQueue())
                .reportSink(resolveReportSink(reportOutputPath))
                .stopSignal(stopSignal)
                .configPath(configPath)
                .build();
    }

    /**
     * Checks run-level requirements in a fixed order so the first defect determines the error.
     */
    List<ResolvedCurrency> validate(BacktestConfig config, HostEngine hostEngine) {
        if (config == null) {
            throw new BacktestException(ErrorCode.NIL_CONFIG);
        }
        if (hostEngine == null) {
            throw new BacktestException(ErrorCode.NIL_HOST_ENGINE);
        }
        if (config.getCurrencySettings() == null || config.getCurrencySettings().isEmpty()) {
            throw new BacktestException(ErrorCode.NO_CURRENCY_SETTINGS);
        }

        List<CurrencySettings> currencySettings = config.getCurrencySettings();
        for (CurrencySettings settings : currencySettings) {
            if (!(settings.getInitialFunds() > 0)) {
                throw new BacktestException(ErrorCode.BAD_INITIAL_FUNDS,
                        "initial funds must be greater than zero. funds=" + settings.getInitialFunds());
            }
        }
        List<AssetType> assets = new ArrayList<>();
        for (CurrencySettings settings : currencySettings) {
            assets.add(AssetType.parse(settings.getAsset()));
        }
        List<ResolvedCurrency> resolved = new ArrayList<>();
        for (int i = 0; i < currencySettings.size(); i++) {
            CurrencySettings settings = currencySettings.get(i);
            ExchangeAdapter adapter = hostEngine.getExchangeByName(settings.getExchangeName())
                    .orElseThrow(() -> new BacktestException(ErrorCode.EXCHANGE_NOT_FOUND,
                            "exchange not found: " + settings.getExchangeName()));
            resolved.add(new ResolvedCurrency(settings, assets.get(i), adapter));
        }

        DataSettings dataSettings = config.getDataSettings();
        if (dataSettings == null || !dataSettings.hasSource()) {
            throw new BacktestException(ErrorCode.NO_DATA_SOURCE);
        }
        DataType.parse(dataSettings.getDataType());
        if (dataSettings.getApiData() != null) {
            requireStartEnd(dataSettings.getApiData().getStartDate(), dataSettings.getApiData().getEndDate());
        } else if (dataSettings.getDatabaseData() != null) {
            requireStartEnd(dataSettings.getDatabaseData().getStartDate(), dataSettings.getDatabaseData().getEndDate());
        }
        Duration interval = dataSettings.getInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new BacktestException(ErrorCode.INTERVAL_UNSET);
        }
        Intervals.requireSupported(interval);

        StrategySettings strategySettings = config.getStrategySettings();
        if (strategySettings == null || !strategyRegistry.isRegistered(strategySettings.getName())) {
            throw new BacktestException(ErrorCode.STRATEGY_NOT_FOUND,
                    "strategy not found: " + (strategySettings == null ? null : strategySettings.getName()));
        }
        return resolved;
    }

    private void validateSettings(BacktestConfig config) {
        Set<PairKey> seen = new HashSet<>();
        for (CurrencySettings settings : config.getCurrencySettings()) {
            if (isBlank(settings.getBase()) || isBlank(settings.getQuote())) {
                throw new BacktestException(ErrorCode.INVALID_CURRENCY_SETTINGS, "base and quote are required");
            }
            if (settings.getMakerFee() < 0 || settings.getTakerFee() < 0) {
                throw new BacktestException(ErrorCode.INVALID_CURRENCY_SETTINGS,
                        "fees must not be negative. maker=" + settings.getMakerFee() + ", taker=" + settings.getTakerFee());
            }
            if (settings.getMaximumHoldingsRatio() < 0 || settings.getMaximumHoldingsRatio() > 1) {
                throw new BacktestException(ErrorCode.INVALID_CURRENCY_SETTINGS,
                        "maximumHoldingsRatio must be between 0 and 1");
            }
            requireConsistent(settings.getBuySide(), "buySide");
            requireConsistent(settings.getSellSide(), "sellSide");
            PairKey key = toKey(settings);
            if (!seen.add(key)) {
                throw new BacktestException(ErrorCode.INVALID_CURRENCY_SETTINGS, "duplicate currency settings for " + key);
            }
        }
        PortfolioSettings portfolioSettings = config.getPortfolioSettings();
        if (portfolioSettings != null) {
            requireConsistent(portfolioSettings.getBuySide(), "portfolio buySide");
            requireConsistent(portfolioSettings.getSellSide(), "portfolio sellSide");
            if (portfolioSettings.getMaximumHoldingsRatio() < 0 || portfolioSettings.getMaximumHoldingsRatio() > 1) {
                throw new BacktestException(ErrorCode.INVALID_CURRENCY_SETTINGS,
                        "portfolio maximumHoldingsRatio must be between 0 and 1");
            }
        }
        if (config.getStatisticSettings() != null && config.getStatisticSettings().getRiskFreeRate() < 0) {
            throw new BacktestException(ErrorCode.INVALID_CURRENCY_SETTINGS, "riskFreeRate must not be negative");
        }
    }

    private void applyStrategySettings(Strategy strategy, StrategySettings strategySettings) {
        if (strategySettings.getCustomSettings() == null) {
            strategy.setDefaults();
            return;
        }
        try {
            strategy.setCustomSettings(strategySettings.getCustomSettings());
        } catch (BacktestException e) {
            if (e.getCode() != ErrorCode.CUSTOM_SETTINGS_UNSUPPORTED) {
                throw e;
            }
            log.warn("event=custom_settings_ignored strategy={} keys={}",
                    strategy.name(), new LinkedHashSet<>(strategySettings.getCustomSettings().keySet()));
            strategy.setDefaults();
        }
    }

    private ReportSink resolveReportSink(String reportOutputPath) {
        if (isBlank(reportOutputPath)) {
            return new LoggingReportSink();
        }
        return new JsonFileReportSink(objectMapper, Path.of(reportOutputPath));
    }

    private static void requireStartEnd(Instant start, Instant end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new BacktestException(ErrorCode.START_END_UNSET,
                    "start and end must be set and start must precede end. start=" + start + ", end=" + end);
        }
    }

    private static void requireConsistent(MinMax minMax, String name) {
        if (minMax != null && !minMax.isConsistent()) {
            throw new BacktestException(ErrorCode.INVALID_CURRENCY_SETTINGS, name + " bounds are inconsistent: " + minMax);
        }
    }

    private static PairKey toKey(CurrencySettings settings) {
        return PairKey.of(settings.getExchangeName(), AssetType.parse(settings.getAsset()),
                CurrencyPair.of(settings.getBase(), settings.getQuote()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record ResolvedCurrency(CurrencySettings settings, AssetType asset, ExchangeAdapter adapter) {

        PairKey key() {
            return PairKey.of(adapter.name(), asset, CurrencyPair.of(settings.getBase(), settings.getQuote()));
        }
    }
}
