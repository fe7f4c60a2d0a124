package org.nowstart.cadence.signal;

import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.Decision;
import org.nowstart.cadence.data.property.OrchestratorProperties;
import org.nowstart.cadence.data.type.TradeAction;
import org.nowstart.cadence.service.BaseDcaAmountService;
import org.nowstart.cadence.signal.core.ScoreMath;
import org.nowstart.cadence.signal.core.Signal;
import org.nowstart.cadence.signal.core.SignalSource;
import org.springframework.stereotype.Service;

/**
 * Collects one signal per enabled source and folds them into a confidence-weighted decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalAggregator {

    private static final String RULE = "=".repeat(60);
    private static final String THIN_RULE = "-".repeat(60);

    private final List<SignalSource> sources;
    private final OrchestratorProperties orchestratorProperties;
    private final BaseDcaAmountService baseDcaAmountService;
    private final Clock clock;

    @PostConstruct
    void init() {
        Map<String, SignalSource> byName = new LinkedHashMap<>();
        for (SignalSource source : sources) {
            SignalSource previous = byName.put(source.name(), source);
            if (previous != null) {
                throw new IllegalStateException("Duplicate signal source registered for name=" + source.name());
            }
        }
    }

    public List<Signal> gatherSignals() {
        List<Signal> signals = new ArrayList<>();
        for (SignalSource source : sources) {
            if (!orchestratorProperties.isEnabled(source.name())) {
                log.info("Skipping disabled signal source. source={}", source.name());
                continue;
            }
            try {
                Signal signal = source.produceSignal();
                signals.add(signal);
                log.info(
                        "event=signal_gathered source={} score={} confidence={}",
                        signal.source(),
                        signal.score(),
                        signal.confidence()
                );
            } catch (Exception e) {
                log.error("Signal source failed and was excluded. source={}", source.name(), e);
            }
        }
        return signals;
    }

    /**
     * Weighted mean of scores where each signal weighs {@code weight x confidence}. Returns 0
     * when that total weight is 0.
     */
    public double computeComposite(List<Signal> signals) {
        Map<String, Double> weights = normalizedWeights(signals);
        double numerator = 0.0;
        double denominator = 0.0;
        for (Signal signal : signals) {
            double effective = weights.getOrDefault(signal.source(), 0.0) * signal.confidence();
            numerator += effective * signal.score();
            denominator += effective;
        }
        if (denominator == 0.0) {
            return 0.0;
        }
        return ScoreMath.clipScore(numerator / denominator);
    }

    public static TradeAction mapAction(double composite) {
        return TradeAction.fromComposite(composite);
    }

    public Decision decide() {
        return decide(gatherSignals());
    }

    public Decision decide(List<Signal> signals) {
        List<Signal> resolved = signals == null ? List.of() : List.copyOf(signals);
        double composite = ScoreMath.round4(computeComposite(resolved));
        TradeAction action = mapAction(composite);
        String rationale = rationale(resolved, composite, action);

        log.info(
                "event=decision action={} multiplier={} composite={} signal_count={}",
                action.label(),
                action.getMultiplier(),
                composite,
                resolved.size()
        );
        if (log.isDebugEnabled()) {
            rationale.lines().forEach(log::debug);
        }
        return new Decision(action, action.getMultiplier(), composite, resolved, rationale, Instant.now(clock));
    }

    /**
     * Configured weights of the sources present in {@code signals}, rescaled to sum to 1.
     */
    public Map<String, Double> normalizedWeights(List<Signal> signals) {
        Map<String, Double> raw = new LinkedHashMap<>();
        for (Signal signal : signals) {
            raw.putIfAbsent(signal.source(), orchestratorProperties.weightOf(signal.source()));
        }
        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0.0) {
            return raw;
        }
        Map<String, Double> normalized = new LinkedHashMap<>();
        raw.forEach((source, weight) -> normalized.put(source, weight / total));
        return normalized;
    }

    private String rationale(List<Signal> signals, double composite, TradeAction action) {
        Map<String, Double> weights = normalizedWeights(signals);
        BigDecimal baseDca = baseDcaAmountService.baseDcaUsd();
        BigDecimal orderSize = baseDca.multiply(BigDecimal.valueOf(action.getMultiplier()));

        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("ORCHESTRATOR DECISION");
        lines.add(RULE);
        for (Signal signal : signals) {
            double weight = weights.getOrDefault(signal.source(), 0.0);
            lines.add("");
            lines.add(String.format(
                    Locale.ROOT,
                    "--- %s (weight=%.0f%%, conf=%.2f, effective=%.4f) ---",
                    signal.source().toUpperCase(Locale.ROOT),
                    weight * 100.0,
                    signal.confidence(),
                    weight * signal.confidence()
            ));
            lines.add(String.format(Locale.ROOT, "  Score: %+.4f", signal.score()));
            signal.rationale().lines().forEach(line -> lines.add("  " + line));
        }
        lines.add("");
        lines.add(THIN_RULE);
        lines.add(String.format(Locale.ROOT, "Composite score: %+.4f", composite));
        lines.add("Action:          " + action.label());
        lines.add(String.format(Locale.ROOT, "DCA multiplier:  %.1fx", action.getMultiplier()));
        lines.add("Base DCA:        $" + baseDca.setScale(0, RoundingMode.HALF_UP).toPlainString());
        lines.add("Order size:      $" + orderSize.setScale(0, RoundingMode.HALF_UP).toPlainString());
        lines.add(RULE);
        return String.join("\n", lines);
    }
}
