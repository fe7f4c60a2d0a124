package org.nowstart.cadence.signal.source;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.OnChainMetric;
import org.nowstart.cadence.data.property.AgentProperties;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.OnChainMetricProvider;
import org.nowstart.cadence.signal.core.BreakpointTable;
import org.nowstart.cadence.signal.core.ScoreMath;
import org.nowstart.cadence.signal.core.Signal;
import org.nowstart.cadence.signal.core.SignalSource;
import org.springframework.stereotype.Component;

/**
 * Position within the four-year halving cycle blended with the MVRV valuation metric.
 */
@Slf4j
@Component
public class CycleSignalSource implements SignalSource {

    public static final String NAME = "cycle";

    static final double CYCLE_WEIGHT = 0.55;
    static final double VALUATION_WEIGHT = 0.45;

    private static final BreakpointTable CYCLE_TABLE = BreakpointTable.builder()
            .point(0.0, 0.8)
            .point(0.30, 0.4)
            .point(0.60, 0.1)
            .point(0.85, -0.2)
            .point(1.0, -0.8)
            .build();

    private static final List<String> PHASES = List.of("early", "mid", "late", "final");

    private static final BreakpointTable VALUATION_TABLE = BreakpointTable.builder()
            .point(0.0, 0.6)
            .point(2.0, 0.0)
            .point(3.5, -0.5)
            .point(7.0, -1.0)
            .belowRange(1.0)
            .build();

    private final OnChainMetricProvider onChainMetricProvider;
    private final AgentProperties.Cycle properties;
    private final Clock clock;

    public CycleSignalSource(OnChainMetricProvider onChainMetricProvider, AgentProperties agentProperties, Clock clock) {
        this.onChainMetricProvider = onChainMetricProvider;
        this.properties = agentProperties.cycle();
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Signal produceSignal() {
        return scoreAt(LocalDate.now(clock));
    }

    public Signal scoreAt(LocalDate date) {
        CollaboratorResult<OnChainMetric> metric = onChainMetricProvider.valuationMetric(date);
        if (!metric.isSuccess()) {
            log.warn("Valuation metric unavailable. date={}, reason={}", date, metric.failureReason());
        }
        return scoreAt(date, metric.isSuccess() ? metric.value() : null);
    }

    /**
     * Pure scoring for a date and an optional valuation metric.
     */
    public Signal scoreAt(LocalDate date, OnChainMetric metric) {
        double progress = progress(date);
        double cycleScore = cycleScore(progress);
        String phase = PHASES.get(CYCLE_TABLE.segmentIndex(progress));

        Double z = metric == null ? null : metric.value();
        double valuationScore = valuationScore(z);
        double finalScore = ScoreMath.round4(
                ScoreMath.clipScore(CYCLE_WEIGHT * cycleScore + VALUATION_WEIGHT * valuationScore));
        double confidence = ScoreMath.round4(confidence(cycleScore, valuationScore, z != null));

        String valuationDetail = z == null
                ? "MVRV: no data -> 0.00"
                : String.format(Locale.ROOT, "MVRV Z=%.2f -> %+.2f", z, valuationScore);
        String source = metric == null ? "unavailable" : metric.sourceLabel();
        String rationale = String.format(
                Locale.ROOT,
                "Halving cycle (%.0f%%): Cycle %.1f%% (%s) -> %+.2f%n"
                        + "MVRV (%.0f%%, src=%s): %s%n"
                        + "Combined: %+.3f  confidence=%.2f",
                CYCLE_WEIGHT * 100.0,
                progress * 100.0,
                phase,
                cycleScore,
                VALUATION_WEIGHT * 100.0,
                source,
                valuationDetail,
                finalScore,
                confidence
        );
        return Signal.of(NAME, finalScore, confidence, rationale);
    }

    double progress(LocalDate date) {
        long days = ChronoUnit.DAYS.between(properties.lastCycleStart(), date);
        return ScoreMath.clipUnit((double) days / properties.averageCycleDays());
    }

    static double cycleScore(double progress) {
        return ScoreMath.clipScore(CYCLE_TABLE.interpolate(progress));
    }

    static double valuationScore(Double z) {
        if (z == null || z.isNaN()) {
            return 0.0;
        }
        return ScoreMath.clipScore(VALUATION_TABLE.interpolate(z));
    }

    static double confidence(double cycleScore, double valuationScore, boolean metricPresent) {
        double dataQuality = metricPresent ? 1.0 : 0.4;
        double agreement;
        if (cycleScore == 0.0 || valuationScore == 0.0) {
            agreement = 0.5;
        } else if (Math.signum(cycleScore) == Math.signum(valuationScore)) {
            agreement = 1.0;
        } else {
            agreement = 0.25;
        }
        double magnitude = (Math.abs(cycleScore) + Math.abs(valuationScore)) / 2.0;
        return ScoreMath.clipUnit(0.40 * dataQuality + 0.35 * agreement + 0.25 * magnitude);
    }
}
