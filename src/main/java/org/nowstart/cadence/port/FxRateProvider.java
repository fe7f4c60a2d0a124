package org.nowstart.cadence.port;

import java.math.BigDecimal;

public interface FxRateProvider {

    /**
     * Units of {@code currency} per one US dollar.
     */
    CollaboratorResult<BigDecimal> usdRate(String currency);
}
