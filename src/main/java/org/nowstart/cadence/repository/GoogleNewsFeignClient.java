package org.nowstart.cadence.repository;

import org.nowstart.cadence.config.FeedFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "googleNewsClient",
        url = "${cadence.agents.geopolitical.base-url:https://news.google.com}",
        configuration = FeedFeignConfig.class
)
public interface GoogleNewsFeignClient {

    /**
     * Raw RSS document.
     */
    @GetMapping(value = "/rss/search", produces = "application/rss+xml")
    String search(
            @RequestParam("q") String query,
            @RequestParam("hl") String language,
            @RequestParam("gl") String country,
            @RequestParam("ceid") String edition
    );
}
