package org.nowstart.backtester.service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.config.ApiData;
import org.nowstart.backtester.data.config.BacktestConfig;
import org.nowstart.backtester.data.config.DataSettings;
import org.nowstart.backtester.data.config.DatabaseData;
import org.nowstart.backtester.data.config.LiveData;
import org.nowstart.backtester.data.dto.ExchangeCredentials;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.DataType;
import org.nowstart.backtester.datahandler.DataHandler;
import org.nowstart.backtester.datahandler.DataRange;
import org.nowstart.backtester.datahandler.Intervals;
import org.nowstart.backtester.datahandler.KlineDataHandler;
import org.nowstart.backtester.datahandler.LiveDataHandler;
import org.nowstart.backtester.engine.StopSignal;
import org.nowstart.backtester.exchange.ExchangeAdapter;
import org.springframework.stereotype.Service;

/**
 * Builds the data handler for one pair from whichever data block the run config sets.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandleLoaderService {

    private static final int MAX_LOGGED_GAPS = 5;

    private final DatabaseCandleSource databaseCandleSource;
    private final CsvCandleSource csvCandleSource;

    public DataHandler loadData(BacktestConfig config, ExchangeAdapter exchange, PairKey key, StopSignal stopSignal) {
        if (config == null || config.getDataSettings() == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "nil config data received");
        }
        DataSettings dataSettings = config.getDataSettings();
        DataType dataType = DataType.parse(dataSettings.getDataType());

        if (dataSettings.getApiData() != null) {
            return loadApiData(dataSettings, exchange, key);
        }
        if (dataSettings.getDatabaseData() != null) {
            return loadDatabaseData(config, key);
        }
        if (dataSettings.getCsvData() != null) {
            return loadCsvData(dataSettings, dataType, key);
        }
        if (dataSettings.getLiveData() != null) {
            return loadLiveData(config, exchange, key, stopSignal);
        }
        throw new BacktestException(ErrorCode.NO_DATA_SOURCE);
    }

    public KlineDataHandler loadApiData(DataSettings dataSettings, ExchangeAdapter exchange, PairKey key) {
        ApiData apiData = dataSettings.getApiData();
        Duration interval = Intervals.requireSupported(dataSettings.getInterval());
        DataRange range = DataRange.of(apiData.getStartDate(), apiData.getEndDate(), interval, apiData.isInclusiveEndDate());
        Instant fetchEnd = apiData.isInclusiveEndDate() ? apiData.getEndDate().plus(interval) : apiData.getEndDate();

        List<OhlcvCandle> candles;
        try {
            candles = exchange.fetchHistoricCandles(key.pair(), key.asset(), range.getStart(), fetchEnd, interval);
        } catch (BacktestException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BacktestException(ErrorCode.DATA_UNAVAILABLE,
                    "unable to retrieve data from " + exchange.name() + " for " + key, e);
        }
        List<OhlcvCandle> inRange = candles.stream().filter(candle -> range.contains(candle.timestamp())).toList();
        return toHandler(key, interval, inRange, range, "api");
    }

    public KlineDataHandler loadDatabaseData(BacktestConfig config, PairKey key) {
        if (config == null || config.getDataSettings() == null || config.getDataSettings().getDatabaseData() == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "nil config data received");
        }
        DatabaseData databaseData = config.getDataSettings().getDatabaseData();
        Instant start = databaseData.getStartDate();
        Instant end = databaseData.getEndDate();
        if (start == null || end == null || !start.isBefore(end)) {
            throw new BacktestException(ErrorCode.START_END_UNSET,
                    "database data start and end must be set. start=" + start + ", end=" + end);
        }
        Duration interval = Intervals.requireSupported(config.getDataSettings().getInterval());

        List<OhlcvCandle> candles;
        try {
            candles = databaseCandleSource.load(key, interval, start, end, databaseData.isInclusiveEndDate());
        } catch (BacktestException e) {
            if (e.getCode() == ErrorCode.NIL_ARGUMENTS) {
                throw e;
            }
            throw new BacktestException(ErrorCode.DATA_UNAVAILABLE, "unable to retrieve data from database", e);
        } catch (RuntimeException e) {
            throw new BacktestException(ErrorCode.DATA_UNAVAILABLE, "unable to retrieve data from database", e);
        }
        DataRange range = DataRange.of(start, end, interval, databaseData.isInclusiveEndDate());
        return toHandler(key, interval, candles, range, "database");
    }

    public KlineDataHandler loadCsvData(DataSettings dataSettings, DataType dataType, PairKey key) {
        String fullPath = dataSettings.getCsvData().getFullPath();
        if (fullPath == null || fullPath.isBlank()) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "csv fullPath is required");
        }
        Duration interval = Intervals.requireSupported(dataSettings.getInterval());
        List<OhlcvCandle> candles = csvCandleSource.load(Path.of(fullPath), dataType, interval);
        if (candles.isEmpty()) {
            throw new BacktestException(ErrorCode.DATA_UNAVAILABLE, "no candles in " + fullPath);
        }
        return new KlineDataHandler(key, interval, candles);
    }

    /**
     * Live handler whose close restores the exchange credentials that were in place before the overrides.
     */
    public LiveDataHandler loadLiveData(
            BacktestConfig config,
            ExchangeAdapter exchange,
            PairKey key,
            StopSignal stopSignal
    ) {
        if (config == null || exchange == null || config.getDataSettings() == null
                || config.getDataSettings().getLiveData() == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "live data requires config, exchange and live settings");
        }
        Duration interval = Intervals.requireSupported(config.getDataSettings().getInterval());
        ExchangeCredentials previous = exchange.getCredentials();
        try {
            prepareLiveExchange(config, exchange);
        } catch (BacktestException e) {
            exchange.setCredentials(previous);
            throw e;
        }
        return new LiveDataHandler(key, interval, interval, exchange, stopSignal, () -> {
            exchange.setCredentials(previous);
            log.info("event=live_credentials_restored exchange={} key={}", exchange.name(), key);
        });
    }

    /**
     * Applies credential overrides from the live block to the exchange and downgrades real orders.
     */
    public void prepareLiveExchange(BacktestConfig config, ExchangeAdapter exchange) {
        if (config == null || exchange == null || config.getDataSettings() == null
                || config.getDataSettings().getLiveData() == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "live data requires config, exchange and live settings");
        }
        LiveData liveData = config.getDataSettings().getLiveData();

        if (liveData.hasCredentialOverrides()) {
            ExchangeCredentials current = exchange.getCredentials();
            exchange.setCredentials(new ExchangeCredentials(
                    override(liveData.getApiKeyOverride(), current.key()),
                    override(liveData.getApiSecretOverride(), current.secret()),
                    override(liveData.getApiClientIdOverride(), current.clientId()),
                    current.pemKey(),
                    override(liveData.getApi2faOverride(), current.oneTimePassword())
            ));
            log.info("event=live_credentials_overridden exchange={}", exchange.name());
        }

        List<String> problems = exchange.validateCredentials();
        if (!problems.isEmpty() && liveData.isAuthenticatedDataRequired()) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS,
                    "authenticated data required but credentials invalid for " + exchange.name() + ": " + problems);
        }
        if (liveData.isRealOrders()) {
            log.warn("event=real_orders_unsupported exchange={} credentialProblems={} action=realOrders_set_false",
                    exchange.name(), problems);
            liveData.setRealOrders(false);
        }
    }

    private KlineDataHandler toHandler(
            PairKey key,
            Duration interval,
            List<OhlcvCandle> candles,
            DataRange range,
            String source
    ) {
        if (candles.isEmpty()) {
            throw new BacktestException(ErrorCode.DATA_UNAVAILABLE,
                    "no candles returned from " + source + " for " + key);
        }
        KlineDataHandler handler = new KlineDataHandler(key, interval, candles, range);
        List<Instant> missing = range.missingSlots();
        if (!missing.isEmpty()) {
            log.warn("[Backtest][DATA] gaps source={} key={} missing={} of {} first={}",
                    source, key, missing.size(), range.slotCount(),
                    missing.subList(0, Math.min(MAX_LOGGED_GAPS, missing.size())));
        }
        log.info("[Backtest][DATA] loaded source={} key={} candles={}", source, key, handler.size());
        return handler;
    }

    private static String override(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
