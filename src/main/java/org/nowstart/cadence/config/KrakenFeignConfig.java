package org.nowstart.cadence.config;

import feign.RequestInterceptor;
import org.nowstart.cadence.data.property.TradingProperties;
import org.nowstart.cadence.service.auth.KrakenAuthRequestInterceptor;
import org.nowstart.cadence.service.auth.KrakenRequestSigner;
import org.springframework.context.annotation.Bean;

/**
 * Client-scoped configuration for the exchange client only. Not a {@code @Configuration} so the
 * interceptor stays out of the shared application context.
 */
public class KrakenFeignConfig {

    @Bean
    public KrakenRequestSigner krakenRequestSigner(TradingProperties tradingProperties) {
        return new KrakenRequestSigner(tradingProperties.apiKey(), tradingProperties.apiSecret());
    }

    @Bean
    public RequestInterceptor krakenAuthRequestInterceptor(KrakenRequestSigner krakenRequestSigner) {
        return new KrakenAuthRequestInterceptor(krakenRequestSigner);
    }
}
