package com.bondtrader.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Policy values for the pipeline stages, bound from the {@code bondtrader.*} prefix.
 *
 * <p>Defaults are the desk's reference policies, so an empty
 * application.properties runs the standard pipeline. Tests construct this
 * class directly and override individual values.
 */
@Configuration
@ConfigurationProperties(prefix = "bondtrader")
@Getter
@Setter
public class PipelineProperties {

    private Position position = new Position();
    private Risk risk = new Risk();
    private Pricing pricing = new Pricing();
    private Execution execution = new Execution();
    private Inquiry inquiry = new Inquiry();
    private Files files = new Files();
    private Runner runner = new Runner();

    /** What the position stage does with a trade that names a book outside TRSY1..TRSY3. */
    public enum UnknownBookPolicy {
        /** Throw UnknownBookException to the caller of the cascade. */
        REJECT,
        /** Log a warning and drop the trade without notifying. */
        SKIP
    }

    /** Scope of the counter that alternates the aggressing side of algo executions. */
    public enum SideAlternation {
        /** One counter for every instrument the stage sees. */
        STAGE,
        /** One counter per instrument. */
        PER_INSTRUMENT
    }

    @Getter
    @Setter
    public static class Position {
        private UnknownBookPolicy unknownBookPolicy = UnknownBookPolicy.REJECT;
    }

    @Getter
    @Setter
    public static class Risk {
        /** Per-unit PV01 applied to every aggregate position. */
        private BigDecimal pv01PerUnit = new BigDecimal("0.02");
    }

    @Getter
    @Setter
    public static class Pricing {
        /** Minimum gap between two quotes delivered to the GUI sink. */
        private long guiThrottleMillis = 300;

        private long streamVisibleQuantity = 1_000_000;
        private long streamHiddenQuantity = 1_000_000;
    }

    @Getter
    @Setter
    public static class Execution {
        /** Widest top-of-book spread the algo will cross. One 1/64 tick by default. */
        private BigDecimal spreadTolerance = new BigDecimal("0.015625");

        /** Hidden quantity as a fraction of the matched quantity, rounded down. */
        private BigDecimal hiddenRatio = new BigDecimal("0.9");

        private SideAlternation sideAlternation = SideAlternation.STAGE;
    }

    @Getter
    @Setter
    public static class Inquiry {
        /** Price the quoting responder assigns when moving an inquiry to QUOTED. */
        private BigDecimal quotePrice = new BigDecimal("100");

        /** Quantity given to inquiries read from the inquiry file. */
        private long defaultQuantity = 1_000_000;
    }

    @Getter
    @Setter
    public static class Files {
        private String inputDir = "data";
        private String outputDir = "output";
    }

    @Getter
    @Setter
    public static class Runner {
        /** Run the four file flows once the context is ready. */
        private boolean enabled = true;
    }
}
