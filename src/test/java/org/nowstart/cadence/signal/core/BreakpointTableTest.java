package org.nowstart.cadence.signal.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class BreakpointTableTest {

    private final BreakpointTable table = BreakpointTable.builder()
            .point(0.0, 1.0)
            .point(1.0, 0.0)
            .point(3.0, -1.0)
            .build();

    @Test
    void interpolate_isLinearBetweenBreakpoints() {
        assertThat(table.interpolate(0.5)).isCloseTo(0.5, within(1e-9));
        assertThat(table.interpolate(2.0)).isCloseTo(-0.5, within(1e-9));
    }

    @Test
    void interpolate_hitsBreakpointsExactly() {
        assertThat(table.interpolate(1.0)).isZero();
        assertThat(table.interpolate(3.0)).isEqualTo(-1.0);
    }

    @Test
    void interpolate_clampsOutsideRange() {
        assertThat(table.interpolate(-2.0)).isEqualTo(1.0);
        assertThat(table.interpolate(10.0)).isEqualTo(-1.0);
    }

    @Test
    void interpolate_usesBelowRangeValueWhenConfigured() {
        BreakpointTable withBelow = BreakpointTable.builder()
                .belowRange(0.7)
                .point(1.0, 1.0)
                .point(2.0, 0.0)
                .build();

        assertThat(withBelow.interpolate(0.5)).isEqualTo(0.7);
        assertThat(withBelow.interpolate(1.0)).isEqualTo(1.0);
    }

    @Test
    void segmentIndex_reportsContainingSegment() {
        assertThat(table.segmentIndex(0.2)).isZero();
        assertThat(table.segmentIndex(2.5)).isEqualTo(1);
        assertThat(table.segmentIndex(9.0)).isEqualTo(1);
    }

    @Test
    void builder_rejectsNonIncreasingBreakpoints() {
        assertThatThrownBy(() -> BreakpointTable.builder().point(1.0, 0.0).point(1.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BreakpointTable.builder().point(1.0, 0.0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
