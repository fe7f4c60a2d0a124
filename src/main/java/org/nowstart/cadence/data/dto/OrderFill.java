package org.nowstart.cadence.data.dto;

import java.math.BigDecimal;

public record OrderFill(
        BigDecimal fillPrice,
        String orderId
) {
}
