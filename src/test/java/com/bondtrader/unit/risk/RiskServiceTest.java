package com.bondtrader.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bondtrader.domain.BondCatalog;
import com.bondtrader.domain.enums.Side;
import com.bondtrader.domain.model.BucketedSector;
import com.bondtrader.domain.model.Instrument;
import com.bondtrader.domain.model.Position;
import com.bondtrader.domain.model.Pv01;
import com.bondtrader.exception.ErrorCode;
import com.bondtrader.exception.UnsupportedCapabilityException;
import com.bondtrader.risk.RiskService;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RiskService: PV01 is linear in the aggregate position and bucketed risk
 * is not supported.
 */
class RiskServiceTest {

    private static final Instrument B05Y = BondCatalog.standard().require("B05y");

    private RiskService riskService;
    private List<Pv01> published;

    @BeforeEach
    void setUp() {
        riskService = new RiskService("RiskService", new BigDecimal("0.02"));
        published = new ArrayList<>();
        riskService.addListener(published::add);
    }

    private static Position positionOf(long trsy1, long trsy2) {
        Position position = new Position(B05Y);
        position.update("TRSY1", Math.abs(trsy1), trsy1 < 0 ? Side.SELL : Side.BUY);
        position.update("TRSY2", Math.abs(trsy2), trsy2 < 0 ? Side.SELL : Side.BUY);
        return position;
    }

    @Test
    @DisplayName("Total risk is pv01 per unit times aggregate quantity")
    void totalRiskIsLinear() {
        riskService.addPosition(positionOf(3_000_000, 2_000_000));

        Pv01 risk = riskService.getData("B05y");
        assertThat(risk.getQuantity()).isEqualTo(5_000_000);
        assertThat(risk.getPv01()).isEqualByComparingTo("0.02");
        assertThat(risk.getTotalRisk()).isEqualByComparingTo("100000");
    }

    @Test
    @DisplayName("Short positions give negative risk and flat gives zero")
    void signFollowsPosition() {
        riskService.addPosition(positionOf(-4_000_000, 1_000_000));
        assertThat(riskService.getData("B05y").getTotalRisk()).isEqualByComparingTo("-60000");

        riskService.addPosition(positionOf(1_000_000, -1_000_000));
        assertThat(riskService.getData("B05y").getTotalRisk()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Each position change publishes a fresh Pv01")
    void publishesPerChange() {
        riskService.addPosition(positionOf(1_000_000, 0));
        riskService.addPosition(positionOf(2_000_000, 0));

        assertThat(published).hasSize(2);
        assertThat(published.get(0)).isNotSameAs(published.get(1));
        assertThat(published.get(1).getTotalRisk()).isEqualByComparingTo("40000");
    }

    @Test
    @DisplayName("Bucketed risk is unsupported")
    void bucketedRiskUnsupported() {
        BucketedSector front = new BucketedSector("FrontEnd", BondCatalog.standard().getInstruments().subList(0, 3));

        assertThatThrownBy(() -> riskService.getBucketedRisk(front))
                .isInstanceOf(UnsupportedCapabilityException.class)
                .hasMessageContaining("FrontEnd")
                .satisfies(e -> assertThat(((UnsupportedCapabilityException) e).getErrorCode())
                        .isEqualTo(ErrorCode.UNSUPPORTED_OPERATION));
    }
}
