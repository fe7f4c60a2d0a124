package org.nowstart.cadence.config;

import feign.RequestInterceptor;
import org.nowstart.cadence.data.property.JudgmentProperties;
import org.nowstart.cadence.service.auth.AnthropicAuthRequestInterceptor;
import org.springframework.context.annotation.Bean;

public class AnthropicFeignConfig {

    @Bean
    public RequestInterceptor anthropicAuthRequestInterceptor(JudgmentProperties judgmentProperties) {
        return new AnthropicAuthRequestInterceptor(judgmentProperties.apiKey(), judgmentProperties.apiVersion());
    }
}
