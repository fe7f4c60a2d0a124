package org.nowstart.cadence.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenAddOrderResult(
        Description descr,
        List<String> txid
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Description(
            String order
    ) {
    }
}
