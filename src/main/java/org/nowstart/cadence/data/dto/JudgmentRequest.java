package org.nowstart.cadence.data.dto;

/**
 * Prompt framing for one judgment call and the JSON field that carries the score in the reply.
 */
public record JudgmentRequest(
        String systemPrompt,
        String userPrompt,
        String scoreField,
        int maxTokens
) {

    public JudgmentRequest {
        if (scoreField == null || scoreField.isBlank()) {
            throw new IllegalArgumentException("scoreField is required");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be > 0");
        }
    }
}
