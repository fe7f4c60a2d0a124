package org.nowstart.cadence.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.KrakenAddOrderResult;
import org.nowstart.cadence.data.dto.KrakenBalance;
import org.nowstart.cadence.data.dto.KrakenOrderInfo;
import org.nowstart.cadence.data.dto.KrakenResponse;
import org.nowstart.cadence.data.dto.OrderFill;
import org.nowstart.cadence.data.property.TradingProperties;
import org.nowstart.cadence.data.type.OrderSide;
import org.nowstart.cadence.port.BalanceProvider;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.OrderPlacer;
import org.nowstart.cadence.repository.KrakenFeignClient;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class KrakenOrderService implements OrderPlacer, BalanceProvider {

    public static final String NO_CREDENTIALS = "No exchange credentials configured";

    private final KrakenFeignClient krakenFeignClient;
    private final TradingProperties tradingProperties;
    private final Clock clock;
    private final AtomicLong lastNonce = new AtomicLong();

    @Override
    public CollaboratorResult<OrderFill> placeMarketOrder(String symbol, OrderSide side, BigDecimal quantity, int leverage) {
        if (quantity == null || quantity.signum() <= 0) {
            return CollaboratorResult.failure("order quantity must be positive");
        }
        if (!tradingProperties.hasCredentials()) {
            return CollaboratorResult.failure(NO_CREDENTIALS);
        }

        StringBuilder form = new StringBuilder()
                .append("nonce=").append(nextNonce())
                .append("&ordertype=market")
                .append("&type=").append(side.name().toLowerCase(Locale.ROOT))
                .append("&volume=").append(quantity.stripTrailingZeros().toPlainString())
                .append("&pair=").append(symbol);
        if (leverage > 1) {
            form.append("&leverage=").append(leverage);
        }

        KrakenResponse<KrakenAddOrderResult> response;
        try {
            response = krakenFeignClient.addOrder(form.toString());
        } catch (Exception e) {
            log.error("AddOrder request failed. symbol={}, quantity={}", symbol, quantity, e);
            return CollaboratorResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        if (response == null || response.hasError()) {
            return CollaboratorResult.failure(response == null ? "empty AddOrder response" : response.errorMessage());
        }
        if (response.result() == null || response.result().txid() == null || response.result().txid().isEmpty()) {
            return CollaboratorResult.failure("AddOrder returned no transaction id");
        }

        String orderId = response.result().txid().get(0);
        return CollaboratorResult.success(new OrderFill(averageFillPrice(orderId), orderId));
    }

    @Override
    public CollaboratorResult<Map<String, BigDecimal>> freeBalances() {
        if (!tradingProperties.hasCredentials()) {
            return CollaboratorResult.failure(NO_CREDENTIALS);
        }
        KrakenResponse<Map<String, KrakenBalance>> response;
        try {
            response = krakenFeignClient.balanceEx("nonce=" + nextNonce());
        } catch (Exception e) {
            log.error("BalanceEx request failed.", e);
            return CollaboratorResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        if (response == null || response.hasError()) {
            return CollaboratorResult.failure(response == null ? "empty BalanceEx response" : response.errorMessage());
        }

        Map<String, KrakenBalance> assets = response.result() == null ? Map.of() : response.result();
        Map<String, BigDecimal> balances = new LinkedHashMap<>();
        balances.put("BTC", free(assets, "XXBT", "XBT"));
        balances.put("USD", free(assets, "ZUSD", "USD"));
        return CollaboratorResult.success(balances);
    }

    private static BigDecimal free(Map<String, KrakenBalance> assets, String... codes) {
        for (String code : codes) {
            KrakenBalance balance = assets.get(code);
            if (balance != null) {
                return balance.free();
            }
        }
        return BigDecimal.ZERO;
    }

    /**
     * Average execution price, or null when the order cannot be queried yet.
     */
    private BigDecimal averageFillPrice(String orderId) {
        try {
            KrakenResponse<Map<String, KrakenOrderInfo>> response = krakenFeignClient.queryOrders(
                    "nonce=" + nextNonce() + "&txid=" + orderId);
            if (response == null || response.hasError() || response.result() == null) {
                return null;
            }
            KrakenOrderInfo info = response.result().get(orderId);
            if (info == null || info.price() == null || info.price().signum() <= 0) {
                return null;
            }
            return info.price();
        } catch (Exception e) {
            log.warn("QueryOrders failed, falling back to quoted price. order_id={}", orderId, e);
            return null;
        }
    }

    private long nextNonce() {
        long candidate = clock.millis() * 1000L;
        return lastNonce.updateAndGet(previous -> Math.max(previous + 1, candidate));
    }
}
