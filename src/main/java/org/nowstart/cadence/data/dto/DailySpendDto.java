package org.nowstart.cadence.data.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DailySpendDto(
        LocalDate date,
        BigDecimal spentUsd,
        BigDecimal maxDailyUsd,
        BigDecimal remainingUsd
) {
}
