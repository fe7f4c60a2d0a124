package org.nowstart.cadence.data.dto;

public record OnChainMetric(
        double value,
        String sourceLabel
) {
}
