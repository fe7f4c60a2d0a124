package org.nowstart.cadence.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenOrderInfo(
        String status,
        BigDecimal vol,
        BigDecimal vol_exec,
        BigDecimal cost,
        BigDecimal fee,
        BigDecimal price
) {
}
