package com.bondtrader.unit.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bondtrader.connector.IngestionReport;
import com.bondtrader.connector.LineFileReader;
import com.bondtrader.exception.MalformedInputException;
import com.bondtrader.exception.UnknownBookException;
import com.bondtrader.observability.PipelineMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for LineFileReader: per-line handling, rejection accounting and missing files.
 */
class LineFileReaderTest {

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry meterRegistry;
    private LineFileReader lineFileReader;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        lineFileReader = new LineFileReader("trades", new PipelineMetricsService(meterRegistry));
    }

    @Test
    @DisplayName("Every non-blank line reaches the handler in file order")
    void linesInOrder() throws IOException {
        Path file = Files.writeString(tempDir.resolve("in.txt"), "a\n\nb\nc\n");
        List<String> seen = new ArrayList<>();

        IngestionReport report = lineFileReader.read(file, seen::add);

        assertThat(seen).containsExactly("a", "b", "c");
        assertThat(report.getLinesRead()).isEqualTo(4);
        assertThat(report.getAccepted()).isEqualTo(3);
        assertThat(report.getRejected()).isZero();
    }

    @Test
    @DisplayName("A failing line is counted and reading continues")
    void failingLineSkipped() throws IOException {
        Path file = Files.writeString(tempDir.resolve("in.txt"), "ok\nbad\nbook\nok\n");
        List<String> seen = new ArrayList<>();

        IngestionReport report = lineFileReader.read(file, line -> {
            if (line.equals("bad")) {
                throw new MalformedInputException("bad line", line);
            }
            if (line.equals("book")) {
                throw new UnknownBookException("TRSY9", "B10y");
            }
            seen.add(line);
        });

        assertThat(seen).containsExactly("ok", "ok");
        assertThat(report.getAccepted()).isEqualTo(2);
        assertThat(report.getRejected()).isEqualTo(2);
        assertThat(meterRegistry.get("pipeline.records.rejected")
                .tag("flow", "trades")
                .tag("error", "MALFORMED_INPUT")
                .counter()
                .count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("pipeline.records.accepted").tag("flow", "trades").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("Exceptions outside the pipeline taxonomy propagate")
    void bugsPropagate() throws IOException {
        Path file = Files.writeString(tempDir.resolve("in.txt"), "x\n");

        assertThatThrownBy(() -> lineFileReader.read(file, line -> {
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Missing file gives an empty report")
    void missingFileSkipped() {
        List<String> seen = new ArrayList<>();

        IngestionReport report = lineFileReader.read(tempDir.resolve("absent.txt"), seen::add);

        assertThat(seen).isEmpty();
        assertThat(report.getLinesRead()).isZero();
        assertThat(report.getSource()).endsWith("absent.txt");
    }
}
