package org.nowstart.cadence.repository;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import org.nowstart.cadence.config.KrakenFeignConfig;
import org.nowstart.cadence.data.dto.KrakenAddOrderResult;
import org.nowstart.cadence.data.dto.KrakenBalance;
import org.nowstart.cadence.data.dto.KrakenOrderInfo;
import org.nowstart.cadence.data.dto.KrakenResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "krakenClient",
        url = "${cadence.trading.base-url}",
        configuration = KrakenFeignConfig.class
)
public interface KrakenFeignClient {

    @GetMapping("/0/public/OHLC")
    KrakenResponse<JsonNode> getOhlc(
            @RequestParam("pair") String pair,
            @RequestParam("interval") int interval
    );

    @GetMapping("/0/public/Ticker")
    KrakenResponse<JsonNode> getTicker(@RequestParam("pair") String pair);

    /**
     * Form body must start with {@code nonce=}; it is signed by the request interceptor.
     */
    @PostMapping(value = "/0/private/AddOrder", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    KrakenResponse<KrakenAddOrderResult> addOrder(@RequestBody String form);

    @PostMapping(value = "/0/private/QueryOrders", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    KrakenResponse<Map<String, KrakenOrderInfo>> queryOrders(@RequestBody String form);

    @PostMapping(value = "/0/private/BalanceEx", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    KrakenResponse<Map<String, KrakenBalance>> balanceEx(@RequestBody String form);
}
