package com.bondtrader.pipeline;

import com.bondtrader.config.PipelineProperties;
import com.bondtrader.connector.IngestionReport;
import com.bondtrader.connector.LineFileReader;
import com.bondtrader.connector.RecordParser;
import com.bondtrader.observability.PipelineMetricsService;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Drives the four input files through the pipeline once the application has started:
 * trades, then prices, then market data, then inquiries.
 *
 * <p>Each file is read to the end before the next one starts. A missing file skips its
 * flow. Disable with {@code bondtrader.runner.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "bondtrader.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    public static final String TRADES_FILE = "trades.txt";
    public static final String PRICES_FILE = "prices.txt";
    public static final String MARKET_DATA_FILE = "marketdata.txt";
    public static final String INQUIRIES_FILE = "inquiries.txt";

    private final BondTradingPipeline pipeline;
    private final RecordParser recordParser;
    private final PipelineMetricsService pipelineMetricsService;
    private final Path inputDir;

    public PipelineRunner(
            BondTradingPipeline pipeline,
            RecordParser recordParser,
            PipelineMetricsService pipelineMetricsService,
            PipelineProperties pipelineProperties) {
        this.pipeline = pipeline;
        this.recordParser = recordParser;
        this.pipelineMetricsService = pipelineMetricsService;
        this.inputDir = Path.of(pipelineProperties.getFiles().getInputDir());
    }

    @Override
    public void run(ApplicationArguments args) {
        List<IngestionReport> reports = runFlows();
        long rejected = reports.stream().mapToLong(IngestionReport::getRejected).sum();
        log.info("All flows finished: {} files, {} rejected records", reports.size(), rejected);
    }

    public List<IngestionReport> runFlows() {
        return List.of(
                reader("trades").read(inputDir.resolve(TRADES_FILE),
                        line -> pipeline.ingestTrade(recordParser.parseTrade(line))),
                reader("prices").read(inputDir.resolve(PRICES_FILE),
                        line -> pipeline.ingestPrice(recordParser.parsePrice(line))),
                reader("marketdata").read(inputDir.resolve(MARKET_DATA_FILE),
                        line -> pipeline.ingestOrderBook(recordParser.parseOrderBook(line))),
                reader("inquiries").read(inputDir.resolve(INQUIRIES_FILE),
                        line -> pipeline.ingestInquiry(recordParser.parseInquiry(line))));
    }

    private LineFileReader reader(String flow) {
        return new LineFileReader(flow, pipelineMetricsService);
    }
}
