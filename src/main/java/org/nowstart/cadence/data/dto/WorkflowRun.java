package org.nowstart.cadence.data.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Outcome of one workflow pass. {@code decision} and {@code result} are null when the pass
 * stopped before deciding or executing; {@code note} then says why.
 */
public record WorkflowRun(
        LocalDate date,
        boolean payDate,
        Decision decision,
        BigDecimal orderSizeUsd,
        OrderResult result,
        String note
) {

    public static WorkflowRun skipped(LocalDate date, boolean payDate, String note) {
        return new WorkflowRun(date, payDate, null, null, null, note);
    }
}
