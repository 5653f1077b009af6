package com.phillippitts.wfmparity.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DifferencesTest {

    @Test
    void absoluteDifferenceIsExact() {
        assertThat(Differences.absolute(25, 26)).isEqualTo(1.0);
        assertThat(Differences.absolute(26, 25)).isEqualTo(1.0);
    }

    @Test
    void percentageHandlesZeroReference() {
        assertThat(Differences.percentage(0, 0)).isEqualTo(0.0);
        assertThat(Differences.percentage(0, 3)).isEqualTo(100.0);
        assertThat(Differences.percentage(-50, -45)).isCloseTo(10.0, within(1e-9));
    }
}
