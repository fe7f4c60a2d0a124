package org.nowstart.cadence.data.type;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Timeframe {
    DAILY(1440, 86_400L),
    WEEKLY(10080, 604_800L);

    private final int intervalMinutes;
    private final long seconds;
}
