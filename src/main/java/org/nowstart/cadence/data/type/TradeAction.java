package org.nowstart.cadence.data.type;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Purchase tiers ordered by descending inclusive lower bound.
 */
@Getter
@RequiredArgsConstructor
public enum TradeAction {
    STRONG_BUY(0.5, 3.0),
    BUY(0.2, 1.5),
    NORMAL(-0.2, 1.0),
    REDUCE(-0.5, 0.5),
    MINIMAL(Double.NEGATIVE_INFINITY, 0.2);

    private final double lowerBound;
    private final double multiplier;

    public static TradeAction fromComposite(double composite) {
        for (TradeAction action : values()) {
            if (composite >= action.lowerBound) {
                return action;
            }
        }
        return MINIMAL;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
