package org.nowstart.backtester.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;

/**
 * Writes the report as {@code <strategy>-report.json} under the output directory.
 */
@Slf4j
public class JsonFileReportSink implements ReportSink {

    private final ObjectMapper objectMapper;
    private final Path outputDirectory;

    public JsonFileReportSink(ObjectMapper objectMapper, Path outputDirectory) {
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.outputDirectory = outputDirectory;
    }

    @Override
    public void publish(BacktestReport report) {
        Path target = resolveTarget(report);
        try {
            Files.createDirectories(outputDirectory);
            objectMapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            throw new BacktestException(ErrorCode.RUN_FAILED, "Failed to write report: " + target, e);
        }
        log.info("[Backtest][REPORT] saved path={}", target.toAbsolutePath());
    }

    Path resolveTarget(BacktestReport report) {
        String safeName = report.strategyName().replaceAll("[^A-Za-z0-9._-]", "_");
        return outputDirectory.resolve(safeName + "-report.json");
    }
}
