package org.nowstart.cadence.port;

import java.math.BigDecimal;
import java.util.Map;

public interface BalanceProvider {

    /**
     * Free (not held by open orders) balances keyed by currency code, {@code BTC} and {@code USD}.
     */
    CollaboratorResult<Map<String, BigDecimal>> freeBalances();
}
