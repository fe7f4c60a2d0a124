package org.nowstart.cadence.repository;

import org.nowstart.cadence.data.dto.ExchangeRateResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(
        name = "exchangeRateClient",
        url = "${cadence.orchestrator.fx-base-url:https://api.exchangerate-api.com}"
)
public interface ExchangeRateFeignClient {

    @GetMapping("/v4/latest/{base}")
    ExchangeRateResponse latest(@PathVariable("base") String base);
}
