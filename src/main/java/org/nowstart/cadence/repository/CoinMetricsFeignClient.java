package org.nowstart.cadence.repository;

import org.nowstart.cadence.data.dto.CoinMetricsResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "coinMetricsClient",
        url = "${cadence.agents.cycle.metric-base-url:https://community-api.coinmetrics.io}"
)
public interface CoinMetricsFeignClient {

    @GetMapping("/v4/timeseries/asset-metrics")
    CoinMetricsResponse getAssetMetrics(
            @RequestParam("assets") String assets,
            @RequestParam("metrics") String metrics,
            @RequestParam("frequency") String frequency,
            @RequestParam("page_size") int pageSize,
            @RequestParam("sort") String sort,
            @RequestParam("sort_direction") String sortDirection
    );
}
