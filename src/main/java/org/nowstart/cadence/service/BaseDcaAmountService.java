package org.nowstart.cadence.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.property.OrchestratorProperties;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.FxRateProvider;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class BaseDcaAmountService {

    static final String CAD = "CAD";

    private final OrchestratorProperties orchestratorProperties;
    private final FxRateProvider fxRateProvider;

    /**
     * Base purchase in USD. A CAD base is converted at the live USD/CAD rate, or at the
     * configured fallback rate when the lookup fails.
     */
    public BigDecimal baseDcaUsd() {
        BigDecimal baseDcaCad = orchestratorProperties.baseDcaCad();
        if (baseDcaCad == null) {
            return orchestratorProperties.baseDcaUsd();
        }
        return baseDcaCad.divide(usdCadRate(), 2, RoundingMode.HALF_UP);
    }

    private BigDecimal usdCadRate() {
        CollaboratorResult<BigDecimal> rate = fxRateProvider.usdRate(CAD);
        if (rate.isSuccess()) {
            return rate.value();
        }
        BigDecimal fallback = orchestratorProperties.fallbackUsdCadRate();
        log.warn("USD/CAD rate unavailable, using fallback. reason={}, fallback={}", rate.failureReason(), fallback);
        return fallback;
    }
}
