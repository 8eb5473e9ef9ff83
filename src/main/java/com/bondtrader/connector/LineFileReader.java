package com.bondtrader.connector;

import com.bondtrader.exception.BaseException;
import com.bondtrader.observability.PipelineMetricsService;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds an input file into a pipeline stage one line at a time.
 *
 * <p>Each non-blank line goes to the handler, which parses it and ingests it. The whole
 * downstream cascade runs inside that call, so the line is fully processed before the
 * next one is read. A {@link BaseException} from parsing or from anywhere in the cascade
 * is logged with the line number, the line is counted as rejected, and reading
 * continues. Any other exception is a bug and propagates.
 */
public class LineFileReader {

    private static final Logger log = LoggerFactory.getLogger(LineFileReader.class);

    private static final int PROGRESS_INTERVAL = 100_000;

    private final String flow;
    private final PipelineMetricsService pipelineMetricsService;

    public LineFileReader(String flow, PipelineMetricsService pipelineMetricsService) {
        this.flow = flow;
        this.pipelineMetricsService = pipelineMetricsService;
    }

    /**
     * @return counts for the file, or an empty report if the file does not exist
     */
    public IngestionReport read(Path file, Consumer<String> lineHandler) {
        if (!Files.isRegularFile(file)) {
            log.warn("[{}] input file {} not found, skipping flow", flow, file);
            return IngestionReport.skipped(file.toString());
        }

        log.info("[{}] reading {}", flow, file);
        long lineNumber = 0;
        long accepted = 0;
        long rejected = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                if (handle(lineNumber, line, lineHandler)) {
                    accepted++;
                } else {
                    rejected++;
                }
                if (lineNumber % PROGRESS_INTERVAL == 0) {
                    log.info("[{}] processed {} lines", flow, lineNumber);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }

        log.info("[{}] finished {}: {} accepted, {} rejected", flow, file, accepted, rejected);
        return new IngestionReport(file.toString(), lineNumber, accepted, rejected);
    }

    private boolean handle(long lineNumber, String line, Consumer<String> lineHandler) {
        try {
            lineHandler.accept(line);
            pipelineMetricsService.recordAccepted(flow);
            return true;
        } catch (BaseException e) {
            if (e.getErrorCode().isBoundary()) {
                log.warn("[{}] line {} rejected ({}): {}", flow, lineNumber, e.getErrorCode().getCode(), e.getMessage());
            } else {
                log.error("[{}] line {} failed mid-cascade ({}): {}", flow, lineNumber, e.getErrorCode().getCode(),
                        e.getMessage(), e);
            }
            pipelineMetricsService.recordRejected(flow, e.getErrorCode());
            return false;
        }
    }
}
