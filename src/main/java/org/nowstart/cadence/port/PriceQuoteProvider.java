package org.nowstart.cadence.port;

import java.math.BigDecimal;

public interface PriceQuoteProvider {

    CollaboratorResult<BigDecimal> currentPrice(String symbol);
}
