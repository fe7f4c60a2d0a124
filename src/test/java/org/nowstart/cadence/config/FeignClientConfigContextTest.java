package org.nowstart.cadence.config;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import org.junit.jupiter.api.Test;
import org.nowstart.cadence.data.property.JudgmentProperties;
import org.nowstart.cadence.data.property.TestProperties;
import org.nowstart.cadence.data.property.TradingProperties;
import org.nowstart.cadence.service.auth.KrakenRequestSigner;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class FeignClientConfigContextTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesTestConfig.class);

    @Test
    void contextLoadsWithKrakenFeignConfig() {
        contextRunner.withUserConfiguration(KrakenFeignConfig.class).run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(KrakenRequestSigner.class);
            assertThat(context.getBean(KrakenRequestSigner.class).hasCredentials()).isTrue();
            assertThat(context).hasSingleBean(RequestInterceptor.class);
        });
    }

    @Test
    void anthropicInterceptorAddsApiHeaders() {
        contextRunner.withUserConfiguration(AnthropicFeignConfig.class).run(context -> {
            RequestTemplate template = new RequestTemplate();
            context.getBean(RequestInterceptor.class).apply(template);

            assertThat(template.headers().get("x-api-key")).containsExactly("sk-test");
            assertThat(template.headers().get("anthropic-version")).containsExactly("2023-06-01");
        });
    }

    @Test
    void feedInterceptorSetsUserAgent() {
        contextRunner.withUserConfiguration(FeedFeignConfig.class).run(context -> {
            RequestTemplate template = new RequestTemplate();
            context.getBean(RequestInterceptor.class).apply(template);

            assertThat(template.headers().get("User-Agent")).containsExactly(FeedFeignConfig.USER_AGENT);
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class PropertiesTestConfig {

        @Bean
        TradingProperties tradingProperties() {
            return TestProperties.trading();
        }

        @Bean
        JudgmentProperties judgmentProperties() {
            return TestProperties.judgment("sk-test");
        }
    }
}
