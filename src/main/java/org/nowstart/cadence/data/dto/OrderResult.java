package org.nowstart.cadence.data.dto;

import java.math.BigDecimal;
import org.nowstart.cadence.data.type.OrderSide;

public record OrderResult(
        boolean executed,
        boolean simulated,
        String symbol,
        OrderSide side,
        BigDecimal usdAmount,
        BigDecimal assetAmount,
        BigDecimal price,
        String orderId,
        int leverage,
        String reason
) {

    public OrderResult {
        if (usdAmount == null || usdAmount.signum() < 0) {
            throw new IllegalArgumentException("usdAmount must be >= 0");
        }
        if (assetAmount != null && assetAmount.signum() < 0) {
            throw new IllegalArgumentException("assetAmount must be >= 0");
        }
        if (price != null && price.signum() <= 0) {
            throw new IllegalArgumentException("price must be > 0");
        }
        if (leverage < 1) {
            throw new IllegalArgumentException("leverage must be >= 1");
        }
    }

    public static OrderResult blocked(
            boolean simulated,
            String symbol,
            OrderSide side,
            BigDecimal usdAmount,
            int leverage,
            String reason
    ) {
        return new OrderResult(false, simulated, symbol, side, usdAmount, null, null, null, leverage, reason);
    }

    /**
     * True when the attempt committed daily budget, either as a live fill or a simulated one.
     */
    public boolean consumedBudget() {
        return executed || (simulated && assetAmount != null);
    }
}
