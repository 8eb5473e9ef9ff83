package com.bondtrader.config;

import com.bondtrader.connector.RecordParser;
import com.bondtrader.domain.BondCatalog;
import com.bondtrader.domain.InstrumentCatalog;
import com.bondtrader.observability.PipelineMetricsService;
import com.bondtrader.pipeline.BondTradingPipeline;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the pipeline and its shared collaborators.
 *
 * <p>The stages themselves are not beans: {@link BondTradingPipeline} owns and wires
 * them, because several flows use their own instance of the same stage type.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public InstrumentCatalog instrumentCatalog() {
        return BondCatalog.standard();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public RecordParser recordParser(InstrumentCatalog instrumentCatalog, PipelineProperties pipelineProperties) {
        return new RecordParser(instrumentCatalog, pipelineProperties.getInquiry().getDefaultQuantity());
    }

    @Bean
    public BondTradingPipeline bondTradingPipeline(
            PipelineProperties pipelineProperties,
            InstrumentCatalog instrumentCatalog,
            Clock clock,
            PipelineMetricsService pipelineMetricsService) {
        return new BondTradingPipeline(
                pipelineProperties,
                instrumentCatalog,
                clock,
                pipelineMetricsService,
                Path.of(pipelineProperties.getFiles().getOutputDir()));
    }
}
