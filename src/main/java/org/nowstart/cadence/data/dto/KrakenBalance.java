package org.nowstart.cadence.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenBalance(
        BigDecimal balance,
        BigDecimal hold_trade
) {

    public BigDecimal free() {
        BigDecimal total = balance == null ? BigDecimal.ZERO : balance;
        BigDecimal held = hold_trade == null ? BigDecimal.ZERO : hold_trade;
        return total.subtract(held).max(BigDecimal.ZERO);
    }
}
