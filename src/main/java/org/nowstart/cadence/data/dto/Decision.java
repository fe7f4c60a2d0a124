package org.nowstart.cadence.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.cadence.data.type.TradeAction;
import org.nowstart.cadence.signal.core.Signal;

public record Decision(
        TradeAction action,
        double multiplier,
        double compositeScore,
        List<Signal> signals,
        String rationale,
        Instant createdAt
) {

    public Decision {
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        if (!(multiplier > 0.0)) {
            throw new IllegalArgumentException("multiplier must be > 0, got " + multiplier);
        }
        if (Double.isNaN(compositeScore) || compositeScore < -1.0 || compositeScore > 1.0) {
            throw new IllegalArgumentException("compositeScore must be in [-1, 1], got " + compositeScore);
        }
        signals = signals == null ? List.of() : List.copyOf(signals);
        rationale = rationale == null ? "" : rationale;
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }
}
