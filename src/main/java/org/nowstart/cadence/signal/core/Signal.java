package org.nowstart.cadence.signal.core;

import java.time.Instant;

/**
 * Bounded opinion produced by one signal source for a single run.
 */
public record Signal(
        String source,
        double score,
        double confidence,
        String rationale,
        Instant createdAt
) {

    public Signal {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        if (Double.isNaN(score) || score < -1.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [-1, 1], got " + score);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        rationale = rationale == null ? "" : rationale;
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static Signal of(String source, double score, double confidence, String rationale) {
        return new Signal(source, score, confidence, rationale, Instant.now());
    }

    public static Signal fallback(String source, String reason) {
        return new Signal(source, 0.0, 0.1, "Fallback: " + reason, Instant.now());
    }
}
