package org.nowstart.cadence.port;

import java.time.LocalDate;
import org.nowstart.cadence.data.dto.OnChainMetric;

public interface OnChainMetricProvider {

    /**
     * Valuation metric for the given date. A failure means no value is available.
     */
    CollaboratorResult<OnChainMetric> valuationMetric(LocalDate date);
}
