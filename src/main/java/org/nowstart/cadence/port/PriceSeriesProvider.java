package org.nowstart.cadence.port;

import org.nowstart.cadence.data.type.Timeframe;

public interface PriceSeriesProvider {

    /**
     * Chronologically ordered closing prices, oldest first.
     */
    CollaboratorResult<double[]> closingPrices(String symbol, Timeframe timeframe, int count);
}
