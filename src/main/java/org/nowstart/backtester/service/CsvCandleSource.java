package org.nowstart.backtester.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.OhlcvCandle;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.DataType;
import org.nowstart.backtester.datahandler.Intervals;
import org.springframework.stereotype.Component;

/**
 * Reads candles from a CSV file with a header row. Candle rows are
 * {@code timestamp,open,high,low,close,volume}; trade rows are {@code timestamp,price,amount}
 * and get bucketed into candles of the requested interval.
 */
@Slf4j
@Component
public class CsvCandleSource {

    public List<OhlcvCandle> load(Path path, DataType dataType, Duration interval) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BacktestException(ErrorCode.DATA_UNAVAILABLE, "Failed to load CSV: " + path, e);
        }
        if (lines.size() < 2) {
            throw new BacktestException(ErrorCode.DATA_UNAVAILABLE, "CSV has no rows: " + path);
        }

        List<OhlcvCandle> candles = dataType == DataType.TRADE
                ? aggregateTrades(parseTrades(lines, path), interval)
                : parseCandles(lines, path);
        log.info("[Backtest][DATA] csv rows={} candles={} path={}", lines.size() - 1, candles.size(), path.toAbsolutePath());
        return candles;
    }

    private List<OhlcvCandle> parseCandles(List<String> lines, Path path) {
        Map<Instant, OhlcvCandle> dedup = new LinkedHashMap<>();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = splitCsvLine(line);
            if (parts.length < 6) {
                throw new BacktestException(ErrorCode.DATA_UNAVAILABLE,
                        "CSV candle row needs 6 columns. path=" + path + ", line=" + (i + 1));
            }
            Instant ts = parseTs(parts[0], path, i + 1);
            dedup.put(ts, new OhlcvCandle(
                    ts,
                    parseDouble(parts[1], path, i + 1),
                    parseDouble(parts[2], path, i + 1),
                    parseDouble(parts[3], path, i + 1),
                    parseDouble(parts[4], path, i + 1),
                    parseDouble(parts[5], path, i + 1)
            ));
        }

        List<OhlcvCandle> out = new ArrayList<>(dedup.values());
        out.sort(Comparator.comparing(OhlcvCandle::timestamp));
        return out;
    }

    private List<Trade> parseTrades(List<String> lines, Path path) {
        List<Trade> trades = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = splitCsvLine(line);
            if (parts.length < 3) {
                throw new BacktestException(ErrorCode.DATA_UNAVAILABLE,
                        "CSV trade row needs 3 columns. path=" + path + ", line=" + (i + 1));
            }
            trades.add(new Trade(
                    parseTs(parts[0], path, i + 1),
                    parseDouble(parts[1], path, i + 1),
                    parseDouble(parts[2], path, i + 1)
            ));
        }
        trades.sort(Comparator.comparing(Trade::timestamp));
        return trades;
    }

    static List<OhlcvCandle> aggregateTrades(List<Trade> trades, Duration interval) {
        List<OhlcvCandle> candles = new ArrayList<>();
        Instant bucket = null;
        double open = 0;
        double high = 0;
        double low = 0;
        double close = 0;
        double volume = 0;
        for (Trade trade : trades) {
            Instant tradeBucket = Intervals.truncate(trade.timestamp(), interval);
            if (!tradeBucket.equals(bucket)) {
                if (bucket != null) {
                    candles.add(new OhlcvCandle(bucket, open, high, low, close, volume));
                }
                bucket = tradeBucket;
                open = trade.price();
                high = trade.price();
                low = trade.price();
                volume = 0;
            }
            high = Math.max(high, trade.price());
            low = Math.min(low, trade.price());
            close = trade.price();
            volume += trade.amount();
        }
        if (bucket != null) {
            candles.add(new OhlcvCandle(bucket, open, high, low, close, volume));
        }
        return candles;
    }

    private Instant parseTs(String raw, Path path, int lineNumber) {
        String ts = raw.trim();
        try {
            if (!ts.isEmpty() && ts.chars().allMatch(Character::isDigit)) {
                long epoch = Long.parseLong(ts);
                // 13자리 이상이면 밀리초로 간주
                return ts.length() >= 13 ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
            }
            if (ts.endsWith("Z") || ts.endsWith("z")) {
                return Instant.parse(ts.substring(0, ts.length() - 1) + "Z");
            }
            return Instant.parse(ts + "Z");
        } catch (RuntimeException e) {
            throw new BacktestException(ErrorCode.DATA_UNAVAILABLE,
                    "invalid CSV timestamp. path=" + path + ", line=" + lineNumber + ", value=" + raw, e);
        }
    }

    private double parseDouble(String raw, Path path, int lineNumber) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new BacktestException(ErrorCode.DATA_UNAVAILABLE,
                    "invalid CSV number. path=" + path + ", line=" + lineNumber + ", value=" + raw, e);
        }
    }

    private String[] splitCsvLine(String line) {
        return line.split(",", -1);
    }

    record Trade(Instant timestamp, double price, double amount) {
    }
}
