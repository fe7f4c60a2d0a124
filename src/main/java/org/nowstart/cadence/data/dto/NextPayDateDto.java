package org.nowstart.cadence.data.dto;

import java.time.LocalDate;

public record NextPayDateDto(
        LocalDate today,
        LocalDate nextPayDate,
        long daysUntil
) {
}
