package org.nowstart.cadence.signal.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.cadence.data.dto.OnChainMetric;
import org.nowstart.cadence.data.property.TestProperties;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.OnChainMetricProvider;
import org.nowstart.cadence.signal.core.Signal;

@ExtendWith(MockitoExtension.class)
class CycleSignalSourceTest {

    private static final LocalDate CYCLE_START = LocalDate.of(2024, 4, 19);

    @Mock
    private OnChainMetricProvider onChainMetricProvider;

    private CycleSignalSource source;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-04-19T12:00:00Z"), ZoneOffset.UTC);
        source = new CycleSignalSource(onChainMetricProvider, TestProperties.agents(), clock);
    }

    @Test
    void produceSignal_blendsCycleAndValuationOnCycleStart() {
        when(onChainMetricProvider.valuationMetric(CYCLE_START))
                .thenReturn(CollaboratorResult.success(new OnChainMetric(0.0, "CoinMetrics MVRV")));

        Signal signal = source.produceSignal();

        assertThat(signal.source()).isEqualTo("cycle");
        assertThat(signal.score()).isEqualTo(0.71);
        assertThat(signal.confidence()).isEqualTo(0.925);
        assertThat(signal.rationale())
                .contains("Cycle 0.0% (early) -> +0.80")
                .contains("src=CoinMetrics MVRV")
                .contains("MVRV Z=0.00 -> +0.60");
    }

    @Test
    void scoreAt_missingMetricLowersConfidence() {
        when(onChainMetricProvider.valuationMetric(CYCLE_START))
                .thenReturn(CollaboratorResult.failure("no data"));

        Signal signal = source.scoreAt(CYCLE_START);

        assertThat(signal.score()).isEqualTo(0.44);
        assertThat(signal.confidence()).isEqualTo(0.435);
        assertThat(signal.rationale()).contains("src=unavailable").contains("MVRV: no data -> 0.00");
    }

    @Test
    void scoreAt_lateCycleWithRichValuationIsBearish() {
        Signal signal = source.scoreAt(CYCLE_START.plusDays(1458), new OnChainMetric(7.5, "lookup"));

        assertThat(signal.score()).isEqualTo(-0.89);
        assertThat(signal.rationale()).contains("(final)");
    }

    @Test
    void progress_isClippedToUnitRange() {
        assertThat(source.progress(CYCLE_START.minusDays(10))).isZero();
        assertThat(source.progress(CYCLE_START.plusDays(729))).isCloseTo(0.5, within(1e-9));
        assertThat(source.progress(CYCLE_START.plusDays(5000))).isEqualTo(1.0);
    }

    @Test
    void valuationScore_mapsBreakpoints() {
        assertThat(CycleSignalSource.valuationScore(-0.5)).isEqualTo(1.0);
        assertThat(CycleSignalSource.valuationScore(2.0)).isZero();
        assertThat(CycleSignalSource.valuationScore(3.5)).isEqualTo(-0.5);
        assertThat(CycleSignalSource.valuationScore(null)).isZero();
        assertThat(CycleSignalSource.valuationScore(Double.NaN)).isZero();
    }

    @Test
    void cycleScore_interpolatesWithinPhase() {
        assertThat(CycleSignalSource.cycleScore(0.15)).isCloseTo(0.6, within(1e-9));
        assertThat(CycleSignalSource.cycleScore(1.0)).isEqualTo(-0.8);
    }

    @Test
    void confidence_penalisesDisagreement() {
        double agree = CycleSignalSource.confidence(0.5, 0.5, true);
        double disagree = CycleSignalSource.confidence(0.5, -0.5, true);

        assertThat(agree).isCloseTo(0.875, within(1e-9));
        assertThat(disagree).isCloseTo(0.6125, within(1e-9));
    }
}
