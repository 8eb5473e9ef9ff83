package com.bondtrader.observability;

import com.bondtrader.exception.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Micrometer counters for the file-driven flows.
 *
 * <ul>
 *   <li><b>pipeline.records.accepted</b> (counter, tag {@code flow}): lines whose whole cascade completed</li>
 *   <li><b>pipeline.records.rejected</b> (counter, tags {@code flow}, {@code error}): lines skipped on error</li>
 *   <li><b>executions.generated</b> (counter): orders produced by the algo execution stage</li>
 *   <li><b>gui.quotes.throttled</b> (counter): quotes dropped by the GUI rate limiter</li>
 * </ul>
 */
@Service
public class PipelineMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter executionsGeneratedCounter;
    private final Counter guiQuotesThrottledCounter;

    public PipelineMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.executionsGeneratedCounter = Counter.builder("executions.generated")
                .description("Execution orders generated by the algo execution stage")
                .register(meterRegistry);

        this.guiQuotesThrottledCounter = Counter.builder("gui.quotes.throttled")
                .description("Quotes dropped by the GUI rate limiter")
                .register(meterRegistry);
    }

    public void recordAccepted(String flow) {
        Counter.builder("pipeline.records.accepted")
                .description("Input records fully processed")
                .tag("flow", flow)
                .register(meterRegistry)
                .increment();
    }

    public void recordRejected(String flow, ErrorCode errorCode) {
        Counter.builder("pipeline.records.rejected")
                .description("Input records skipped because of an error")
                .tag("flow", flow)
                .tag("error", errorCode.getCode())
                .register(meterRegistry)
                .increment();
    }

    public void recordExecutionGenerated() {
        executionsGeneratedCounter.increment();
    }

    public void recordQuoteThrottled() {
        guiQuotesThrottledCounter.increment();
    }
}
