package org.nowstart.backtester.data.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestConfigLoader {

    private final ObjectMapper objectMapper;

    public BacktestConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new BacktestException(ErrorCode.NIL_CONFIG, "config file not found: " + path);
        }
        try {
            BacktestConfig config = objectMapper.readValue(path.toFile(), BacktestConfig.class);
            log.info("[Backtest][CONFIG] loaded path={} nickname={}", path.toAbsolutePath(), config.getNickname());
            return config;
        } catch (IOException e) {
            throw new BacktestException(ErrorCode.NIL_CONFIG, "Failed to read config: " + path, e);
        }
    }
}
