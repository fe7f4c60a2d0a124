package org.nowstart.cadence.data.type;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ScheduleStatus {
    PENDING,
    CONFIRMED,
    MISSED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
