package org.nowstart.cadence.signal.indicator;

import org.nowstart.cadence.signal.core.IndicatorScore;

public interface IndicatorScorer {

    String name();

    /**
     * Scores a chronologically ordered close series. Never throws for short or empty input.
     */
    IndicatorScore score(double[] close);
}
