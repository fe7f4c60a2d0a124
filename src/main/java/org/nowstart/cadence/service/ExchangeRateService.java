package org.nowstart.cadence.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.ExchangeRateResponse;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.FxRateProvider;
import org.nowstart.cadence.repository.ExchangeRateFeignClient;
import org.springframework.stereotype.Service;

/**
 * USD-based exchange rates. A fetched rate is reused for an hour.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExchangeRateService implements FxRateProvider {

    static final String BASE_CURRENCY = "USD";
    static final Duration CACHE_TTL = Duration.ofHours(1);

    private final ExchangeRateFeignClient exchangeRateFeignClient;
    private final Clock clock;
    private final Map<String, CachedRate> cache = new ConcurrentHashMap<>();

    @Override
    public CollaboratorResult<BigDecimal> usdRate(String currency) {
        String code = currency.toUpperCase(Locale.ROOT);
        Instant now = clock.instant();
        CachedRate cached = cache.get(code);
        if (cached != null && now.isBefore(cached.fetchedAt().plus(CACHE_TTL))) {
            return CollaboratorResult.success(cached.rate());
        }

        ExchangeRateResponse response;
        try {
            response = exchangeRateFeignClient.latest(BASE_CURRENCY);
        } catch (Exception e) {
            log.warn("Exchange rate fetch failed. currency={}", code, e);
            return CollaboratorResult.failure("exchange rate fetch failed: " + e.getMessage());
        }
        BigDecimal rate = response == null || response.rates() == null ? null : response.rates().get(code);
        if (rate == null || rate.signum() <= 0) {
            return CollaboratorResult.failure("no " + BASE_CURRENCY + "/" + code + " rate in response");
        }
        cache.put(code, new CachedRate(rate, now));
        return CollaboratorResult.success(rate);
    }

    private record CachedRate(BigDecimal rate, Instant fetchedAt) {
    }
}
