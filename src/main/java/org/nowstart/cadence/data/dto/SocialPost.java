package org.nowstart.cadence.data.dto;

import java.time.Instant;

public record SocialPost(
        String community,
        String author,
        String title,
        String body,
        Instant createdAt,
        int score,
        int comments
) {
}
