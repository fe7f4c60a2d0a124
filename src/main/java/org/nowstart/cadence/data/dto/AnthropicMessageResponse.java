package org.nowstart.cadence.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnthropicMessageResponse(
        String id,
        String model,
        String stop_reason,
        List<Content> content
) {

    public String firstText() {
        if (content == null) {
            return null;
        }
        return content.stream()
                .filter(block -> "text".equals(block.type()) && block.text() != null)
                .map(Content::text)
                .findFirst()
                .orElse(null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Content(
            String type,
            String text
    ) {
    }
}
