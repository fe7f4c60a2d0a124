package org.nowstart.cadence.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import org.nowstart.cadence.data.type.ScheduleStatus;
import org.nowstart.cadence.data.type.TradeAction;

public record ScheduledBuy(
        LocalDate date,
        String plannedTime,
        ScheduleStatus status,
        BigDecimal plannedAmountUsd,
        Instant executedAt,
        BigDecimal actualAmountUsd,
        BigDecimal actualAmountAsset,
        BigDecimal price,
        TradeAction action,
        Double multiplier,
        Boolean simulated,
        String tradeReason
) {

    public ScheduledBuy {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
    }

    public static ScheduledBuy pending(LocalDate date, String plannedTime, BigDecimal plannedAmountUsd) {
        return new ScheduledBuy(
                date,
                plannedTime,
                ScheduleStatus.PENDING,
                plannedAmountUsd,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null
        );
    }

    public static ScheduledBuy confirmedDirectly(
            LocalDate date,
            String plannedTime,
            Instant executedAt,
            OrderResult result,
            Decision decision
    ) {
        return pending(date, plannedTime, result.usdAmount()).confirm(executedAt, result, decision);
    }

    public ScheduledBuy confirm(Instant executedAt, OrderResult result, Decision decision) {
        requirePending(ScheduleStatus.CONFIRMED);
        return new ScheduledBuy(
                date,
                plannedTime,
                ScheduleStatus.CONFIRMED,
                plannedAmountUsd,
                executedAt,
                result.usdAmount(),
                result.assetAmount(),
                result.price(),
                decision.action(),
                decision.multiplier(),
                result.simulated(),
                result.reason()
        );
    }

    public ScheduledBuy markMissed() {
        requirePending(ScheduleStatus.MISSED);
        return new ScheduledBuy(
                date,
                plannedTime,
                ScheduleStatus.MISSED,
                plannedAmountUsd,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null
        );
    }

    private void requirePending(ScheduleStatus target) {
        if (status != ScheduleStatus.PENDING) {
            throw new IllegalStateException("Cannot move scheduled buy " + date + " from " + status + " to " + target);
        }
    }
}
