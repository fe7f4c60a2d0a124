package org.nowstart.cadence.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoinMetricsResponse(
        List<Map<String, String>> data
) {
}
