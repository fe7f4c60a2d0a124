package org.nowstart.cadence.repository;

import org.nowstart.cadence.config.AnthropicFeignConfig;
import org.nowstart.cadence.data.dto.AnthropicMessageRequest;
import org.nowstart.cadence.data.dto.AnthropicMessageResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "anthropicClient",
        url = "${cadence.judgment.base-url}",
        configuration = AnthropicFeignConfig.class
)
public interface AnthropicFeignClient {

    @PostMapping(value = "/v1/messages", consumes = "application/json")
    AnthropicMessageResponse createMessage(@RequestBody AnthropicMessageRequest request);
}
