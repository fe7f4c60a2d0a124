package org.nowstart.cadence.data.type;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
