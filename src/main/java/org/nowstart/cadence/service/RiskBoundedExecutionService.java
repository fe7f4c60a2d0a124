package org.nowstart.cadence.service;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.BalanceDto;
import org.nowstart.cadence.data.dto.DailySpendDto;
import org.nowstart.cadence.data.dto.OrderFill;
import org.nowstart.cadence.data.dto.OrderResult;
import org.nowstart.cadence.data.property.TradingProperties;
import org.nowstart.cadence.data.type.OrderSide;
import org.nowstart.cadence.port.BalanceProvider;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.OrderPlacer;
import org.nowstart.cadence.port.PriceQuoteProvider;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

/**
 * Places market buys behind the kill switch, the per-order cap and the per-day cap.
 *
 * <p>Every outcome is returned as an {@link OrderResult}; nothing here throws for a blocked
 * or failed order. Only spend that actually went out (a live fill or a simulated fill)
 * is written to the daily ledger.
 */
@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class RiskBoundedExecutionService {

    public static final String REASON_KILL_SWITCH = "Kill switch is ON — all trading halted";
    public static final String REASON_NO_PRICE = "Could not fetch current price";
    public static final String REASON_DRY_RUN = "Dry run — no order placed";
    public static final String REASON_FILLED = "Order filled";
    public static final String REASON_INVALID_AMOUNT = "Order amount must be positive";
    public static final String REASON_BELOW_CENT = "Order amount rounds to less than $0.01";

    private static final int USD_SCALE = 2;
    private static final int ASSET_SCALE = 8;

    private final TradingProperties tradingProperties;
    private final DailySpendLedger dailySpendLedger;
    private final PriceQuoteProvider priceQuoteProvider;
    private final OrderPlacer orderPlacer;
    private final BalanceProvider balanceProvider;
    private final Clock clock;

    public OrderResult execute(BigDecimal requestedUsd) {
        boolean simulated = tradingProperties.simulated();
        String symbol = tradingProperties.symbol();
        int leverage = tradingProperties.leverage();

        if (tradingProperties.killSwitch()) {
            return blocked(simulated, requestedUsd, REASON_KILL_SWITCH);
        }
        if (requestedUsd == null || requestedUsd.signum() <= 0) {
            return blocked(simulated, BigDecimal.ZERO, REASON_INVALID_AMOUNT);
        }

        BigDecimal amountUsd = requestedUsd;
        if (amountUsd.compareTo(tradingProperties.maxOrderUsd()) > 0) {
            log.warn("Order exceeds per-order cap, clamping. requested={}, max={}", amountUsd, tradingProperties.maxOrderUsd());
            amountUsd = tradingProperties.maxOrderUsd();
        }

        LocalDate today = today();
        BigDecimal spent = dailySpendLedger.spentOn(today);
        BigDecimal remaining = tradingProperties.maxDailyUsd().subtract(spent);
        if (remaining.signum() <= 0) {
            return blocked(simulated, amountUsd, "Daily limit reached ($" + whole(spent) + " / $" + whole(tradingProperties.maxDailyUsd()) + ")");
        }
        if (amountUsd.compareTo(remaining) > 0) {
            log.warn("Order would exceed daily cap, clamping. requested={}, remaining={}", amountUsd, remaining);
            amountUsd = remaining;
        }
        amountUsd = amountUsd.setScale(USD_SCALE, RoundingMode.DOWN);
        if (amountUsd.signum() <= 0) {
            return blocked(simulated, amountUsd, REASON_BELOW_CENT);
        }

        CollaboratorResult<BigDecimal> quote = priceQuoteProvider.currentPrice(symbol);
        if (!quote.isSuccess() || quote.value().signum() <= 0) {
            log.error("Price fetch failed. symbol={}, reason={}", symbol, quote.failureReason());
            return blocked(simulated, amountUsd, REASON_NO_PRICE);
        }
        BigDecimal price = quote.value();
        BigDecimal assetAmount = amountUsd.divide(price, ASSET_SCALE, RoundingMode.DOWN);
        BigDecimal roundedPrice = price.setScale(USD_SCALE, RoundingMode.HALF_UP);

        if (simulated) {
            String reason = recordSpend(today, amountUsd, REASON_DRY_RUN);
            log.info(
                    "event=order_simulated symbol={} usd={} asset={} price={}",
                    symbol,
                    amountUsd,
                    assetAmount,
                    roundedPrice
            );
            return new OrderResult(false, true, symbol, OrderSide.BUY, amountUsd, assetAmount, roundedPrice, null, leverage, reason);
        }

        CollaboratorResult<OrderFill> fill = orderPlacer.placeMarketOrder(symbol, OrderSide.BUY, assetAmount, leverage);
        if (!fill.isSuccess()) {
            log.error("event=order_failed symbol={} usd={} reason={}", symbol, amountUsd, fill.failureReason());
            return new OrderResult(
                    false,
                    false,
                    symbol,
                    OrderSide.BUY,
                    amountUsd,
                    assetAmount,
                    roundedPrice,
                    null,
                    leverage,
                    "Exchange error: " + fill.failureReason()
            );
        }

        String reason = recordSpend(today, amountUsd, REASON_FILLED);
        BigDecimal fillPrice = fill.value().fillPrice() == null || fill.value().fillPrice().signum() <= 0
                ? roundedPrice
                : fill.value().fillPrice().setScale(USD_SCALE, RoundingMode.HALF_UP);
        log.info(
                "event=order_filled symbol={} order_id={} usd={} asset={} price={}",
                symbol,
                fill.value().orderId(),
                amountUsd,
                assetAmount,
                fillPrice
        );
        return new OrderResult(true, false, symbol, OrderSide.BUY, amountUsd, assetAmount, fillPrice, fill.value().orderId(), leverage, reason);
    }

    public BigDecimal dailySpend() {
        return dailySpendLedger.spentOn(today());
    }

    /**
     * Free exchange balances, or an empty list when they cannot be fetched.
     */
    public List<BalanceDto> balances() {
        CollaboratorResult<Map<String, BigDecimal>> result = balanceProvider.freeBalances();
        if (!result.isSuccess()) {
            log.error("Balance fetch failed. reason={}", result.failureReason());
            return List.of();
        }
        return result.value().entrySet().stream()
                .map(entry -> new BalanceDto(entry.getKey(), entry.getValue()))
                .toList();
    }

    public DailySpendDto spendSummary(LocalDate date) {
        LocalDate resolved = date == null ? today() : date;
        BigDecimal spent = dailySpendLedger.spentOn(resolved);
        BigDecimal remaining = tradingProperties.maxDailyUsd().subtract(spent).max(BigDecimal.ZERO);
        return new DailySpendDto(resolved, spent, tradingProperties.maxDailyUsd(), remaining);
    }

    private String recordSpend(LocalDate date, BigDecimal amountUsd, String reason) {
        try {
            dailySpendLedger.record(date, amountUsd);
            return reason;
        } catch (UncheckedIOException e) {
            log.error("Failed to record daily spend. date={}, usd={}", date, amountUsd, e);
            return reason + " (ledger write failed)";
        }
    }

    private OrderResult blocked(boolean simulated, BigDecimal amountUsd, String reason) {
        log.warn("event=order_blocked reason={}", reason);
        BigDecimal usd = amountUsd == null || amountUsd.signum() < 0
                ? BigDecimal.ZERO
                : amountUsd.setScale(USD_SCALE, RoundingMode.HALF_UP);
        return OrderResult.blocked(simulated, tradingProperties.symbol(), OrderSide.BUY, usd, tradingProperties.leverage(), reason);
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), tradingProperties.zone());
    }

    private static String whole(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }
}
