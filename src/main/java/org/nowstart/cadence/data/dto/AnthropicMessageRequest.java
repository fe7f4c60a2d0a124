package org.nowstart.cadence.data.dto;

import java.util.List;

public record AnthropicMessageRequest(
        String model,
        int max_tokens,
        String system,
        List<Message> messages
) {

    public static AnthropicMessageRequest of(String model, JudgmentRequest request) {
        return new AnthropicMessageRequest(
                model,
                request.maxTokens(),
                request.systemPrompt(),
                List.of(new Message("user", request.userPrompt()))
        );
    }

    public record Message(
            String role,
            String content
    ) {
    }
}
