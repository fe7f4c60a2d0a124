package org.nowstart.cadence.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class AnthropicAuthRequestInterceptor implements RequestInterceptor {

    private final String apiKey;
    private final String apiVersion;

    @Override
    public void apply(RequestTemplate template) {
        template.header("x-api-key", apiKey);
        template.header("anthropic-version", apiVersion);
        template.header("content-type", "application/json");
        template.header("Accept", "application/json");
    }
}
