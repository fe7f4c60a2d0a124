package org.nowstart.cadence.config;

import feign.RequestInterceptor;
import org.springframework.context.annotation.Bean;

public class FeedFeignConfig {

    static final String USER_AGENT = "bitcoin-bot/1.0";

    @Bean
    public RequestInterceptor feedUserAgentInterceptor() {
        return template -> template.header("User-Agent", USER_AGENT);
    }
}
