package org.nowstart.cadence.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.cadence.data.type.TradeAction;

public record TradeRecord(
        Instant timestamp,
        TradeAction action,
        double multiplier,
        double compositeScore,
        BigDecimal amountUsd,
        BigDecimal amountAsset,
        BigDecimal price,
        int leverage,
        boolean executed,
        boolean simulated,
        String reason
) {

    public static TradeRecord of(Decision decision, OrderResult result) {
        return new TradeRecord(
                decision.createdAt(),
                decision.action(),
                decision.multiplier(),
                decision.compositeScore(),
                result.usdAmount(),
                result.assetAmount(),
                result.price(),
                result.leverage(),
                result.executed(),
                result.simulated(),
                result.reason()
        );
    }
}
