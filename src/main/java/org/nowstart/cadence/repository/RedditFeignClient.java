package org.nowstart.cadence.repository;

import org.nowstart.cadence.config.FeedFeignConfig;
import org.nowstart.cadence.data.dto.RedditListingResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "redditClient",
        url = "${cadence.agents.sentiment.base-url:https://www.reddit.com}",
        configuration = FeedFeignConfig.class
)
public interface RedditFeignClient {

    @GetMapping("/r/{subreddit}/{sort}.json")
    RedditListingResponse getListing(
            @PathVariable("subreddit") String subreddit,
            @PathVariable("sort") String sort,
            @RequestParam("limit") int limit,
            @RequestParam("raw_json") int rawJson
    );
}
