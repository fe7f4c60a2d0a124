package org.nowstart.cadence.data.dto;

import java.math.BigDecimal;

public record BalanceDto(
        String currency,
        BigDecimal free
) {
}
