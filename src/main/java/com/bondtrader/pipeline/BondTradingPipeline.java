package com.bondtrader.pipeline;

import com.bondtrader.booking.TradeBookingService;
import com.bondtrader.config.PipelineProperties;
import com.bondtrader.connector.FileRecordConnector;
import com.bondtrader.connector.RecordFormats;
import com.bondtrader.domain.InstrumentCatalog;
import com.bondtrader.domain.enums.Market;
import com.bondtrader.domain.model.ExecutionOrder;
import com.bondtrader.domain.model.Inquiry;
import com.bondtrader.domain.model.OrderBook;
import com.bondtrader.domain.model.Position;
import com.bondtrader.domain.model.Price;
import com.bondtrader.domain.model.PriceStream;
import com.bondtrader.domain.model.Pv01;
import com.bondtrader.domain.model.Trade;
import com.bondtrader.execution.AlgoExecutionService;
import com.bondtrader.execution.ExecutionService;
import com.bondtrader.historical.HistoricalDataService;
import com.bondtrader.inquiry.InquiryQuotingResponder;
import com.bondtrader.inquiry.InquiryService;
import com.bondtrader.marketdata.MarketDataService;
import com.bondtrader.observability.PipelineMetricsService;
import com.bondtrader.position.PositionService;
import com.bondtrader.pricing.AlgoStreamingService;
import com.bondtrader.pricing.GuiService;
import com.bondtrader.pricing.PricingService;
import com.bondtrader.pricing.StreamingService;
import com.bondtrader.risk.RiskService;
import java.nio.file.Path;
import java.time.Clock;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds every stage and connects them into the four flows. The graph is fixed once the
 * constructor returns.
 *
 * <pre>
 * trades:      TradeBooking -> Position -> [position history, Risk -> risk history]
 * prices:      Pricing -> [Gui (throttled) -> gui sink, AlgoStreaming -> Streaming -> streaming history]
 * market data: MarketData -> AlgoExecution -> Execution -> [TradeBooking' -> Position' -> [history, Risk' -> history],
 *                                                           execution history]
 * inquiries:   Inquiry -> [all-inquiries history, quoting responder -> Inquiry]
 * </pre>
 *
 * <p>Listener order above is notification order. The execution flow books into its own
 * trade booking, position and risk stages so file trades and algo fills are reported
 * separately.
 */
@Getter
public class BondTradingPipeline {

    private static final Logger log = LoggerFactory.getLogger(BondTradingPipeline.class);

    public static final String POSITIONS_FILE = "positions.txt";
    public static final String RISK_FILE = "risk.txt";
    public static final String GUI_FILE = "gui.txt";
    public static final String STREAMING_FILE = "streaming.txt";
    public static final String EXECUTIONS_FILE = "executions.txt";
    public static final String EXECUTION_POSITIONS_FILE = "execution_positions.txt";
    public static final String EXECUTION_RISK_FILE = "execution_risk.txt";
    public static final String ALL_INQUIRIES_FILE = "allinquiries.txt";

    // trades
    private final TradeBookingService tradeBookingService;
    private final PositionService positionService;
    private final RiskService riskService;
    private final HistoricalDataService<Position> positionHistory;
    private final HistoricalDataService<Pv01> riskHistory;

    // prices
    private final PricingService pricingService;
    private final GuiService guiService;
    private final AlgoStreamingService algoStreamingService;
    private final StreamingService streamingService;
    private final HistoricalDataService<PriceStream> streamingHistory;

    // market data
    private final MarketDataService marketDataService;
    private final AlgoExecutionService algoExecutionService;
    private final ExecutionService executionService;
    private final HistoricalDataService<ExecutionOrder> executionHistory;
    private final TradeBookingService executionBookingService;
    private final PositionService executionPositionService;
    private final RiskService executionRiskService;
    private final HistoricalDataService<Position> executionPositionHistory;
    private final HistoricalDataService<Pv01> executionRiskHistory;

    // inquiries
    private final InquiryService inquiryService;
    private final HistoricalDataService<Inquiry> inquiryHistory;

    public BondTradingPipeline(
            PipelineProperties properties,
            InstrumentCatalog catalog,
            Clock clock,
            PipelineMetricsService pipelineMetricsService,
            Path outputDir) {
        PipelineProperties.UnknownBookPolicy unknownBookPolicy =
                properties.getPosition().getUnknownBookPolicy();

        // ---- trades ----
        tradeBookingService = new TradeBookingService("TradeBookingService");
        positionService = new PositionService("PositionService", catalog, unknownBookPolicy);
        riskService = new RiskService("RiskService", properties.getRisk().getPv01PerUnit());
        positionHistory = positionHistory("PositionHistory", outputDir.resolve(POSITIONS_FILE), clock);
        riskHistory = riskHistory("RiskHistory", outputDir.resolve(RISK_FILE), clock);

        tradeBookingService.addListener(positionService::addTrade);
        positionService.addListener(positionHistory::persist);
        positionService.addListener(riskService::addPosition);
        riskService.addListener(riskHistory::persist);

        // ---- prices ----
        PipelineProperties.Pricing pricing = properties.getPricing();
        pricingService = new PricingService();
        guiService = new GuiService(
                new FileRecordConnector<>(outputDir.resolve(GUI_FILE), clock, RecordFormats::gui),
                clock,
                pricing.getGuiThrottleMillis());
        algoStreamingService =
                new AlgoStreamingService(pricing.getStreamVisibleQuantity(), pricing.getStreamHiddenQuantity());
        streamingService = new StreamingService();
        streamingHistory = new HistoricalDataService<>(
                "StreamingHistory",
                new FileRecordConnector<>(outputDir.resolve(STREAMING_FILE), clock, RecordFormats::stream),
                stream -> stream.getInstrument().getInstrumentId());

        pricingService.addListener(price -> {
            if (!guiService.provideData(price)) {
                pipelineMetricsService.recordQuoteThrottled();
            }
        });
        pricingService.addListener(algoStreamingService::publishPrice);
        algoStreamingService.addListener(streamingService::publishPrice);
        streamingService.addListener(streamingHistory::persist);

        // ---- market data ----
        PipelineProperties.Execution execution = properties.getExecution();
        marketDataService = new MarketDataService();
        algoExecutionService = new AlgoExecutionService(
                execution.getSpreadTolerance(), execution.getHiddenRatio(), execution.getSideAlternation());
        executionService = new ExecutionService(Market.CME);
        executionHistory = new HistoricalDataService<>(
                "ExecutionHistory",
                new FileRecordConnector<>(outputDir.resolve(EXECUTIONS_FILE), clock, RecordFormats::execution),
                ExecutionOrder::getOrderId);
        executionBookingService = new TradeBookingService("ExecutionTradeBookingService");
        executionPositionService = new PositionService("ExecutionPositionService", catalog, unknownBookPolicy);
        executionRiskService = new RiskService("ExecutionRiskService", properties.getRisk().getPv01PerUnit());
        executionPositionHistory = positionHistory(
                "ExecutionPositionHistory", outputDir.resolve(EXECUTION_POSITIONS_FILE), clock);
        executionRiskHistory = riskHistory("ExecutionRiskHistory", outputDir.resolve(EXECUTION_RISK_FILE), clock);

        marketDataService.addListener(algoExecutionService::execute);
        algoExecutionService.addListener(order -> pipelineMetricsService.recordExecutionGenerated());
        algoExecutionService.addListener(executionService::executeOrder);
        executionService.addListener(executionBookingService::bookExecution);
        executionService.addListener(executionHistory::persist);
        executionBookingService.addListener(executionPositionService::addTrade);
        executionPositionService.addListener(executionPositionHistory::persist);
        executionPositionService.addListener(executionRiskService::addPosition);
        executionRiskService.addListener(executionRiskHistory::persist);

        // ---- inquiries ----
        inquiryService = new InquiryService();
        inquiryHistory = new HistoricalDataService<>(
                "InquiryHistory",
                new FileRecordConnector<>(outputDir.resolve(ALL_INQUIRIES_FILE), clock, RecordFormats::inquiry),
                Inquiry::getInquiryId);

        inquiryService.addListener(inquiryHistory::persist);
        inquiryService.addListener(
                new InquiryQuotingResponder(inquiryService, properties.getInquiry().getQuotePrice()));

        log.info("Bond trading pipeline wired, writing records to {}", outputDir.toAbsolutePath());
    }

    public void ingestTrade(Trade trade) {
        tradeBookingService.bookTrade(trade);
    }

    public void ingestPrice(Price price) {
        pricingService.onMessage(price);
    }

    public void ingestOrderBook(OrderBook orderBook) {
        marketDataService.onMessage(orderBook);
    }

    public void ingestInquiry(Inquiry inquiry) {
        inquiryService.onMessage(inquiry);
    }

    private static HistoricalDataService<Position> positionHistory(String name, Path file, Clock clock) {
        return new HistoricalDataService<>(
                name,
                new FileRecordConnector<>(file, clock, RecordFormats::position),
                position -> position.getInstrument().getInstrumentId());
    }

    private static HistoricalDataService<Pv01> riskHistory(String name, Path file, Clock clock) {
        return new HistoricalDataService<>(
                name,
                new FileRecordConnector<>(file, clock, RecordFormats::risk),
                risk -> risk.getInstrument().getInstrumentId());
    }
}
