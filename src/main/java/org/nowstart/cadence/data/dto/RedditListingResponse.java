package org.nowstart.cadence.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RedditListingResponse(
        Listing data
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Listing(
            List<Child> children
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Child(
            RedditPost data
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RedditPost(
            String author,
            String title,
            String selftext,
            double created_utc,
            int score,
            int num_comments,
            boolean stickied
    ) {
    }
}
