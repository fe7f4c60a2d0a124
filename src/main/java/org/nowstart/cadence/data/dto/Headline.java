package org.nowstart.cadence.data.dto;

public record Headline(
        String source,
        String title,
        String description,
        String publishedAt
) {
}
