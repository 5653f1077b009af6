package com.phillippitts.wfmparity.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatisticsTest {

    @Test
    void sampleStdDevUsesNMinusOne() {
        assertThat(Statistics.sampleStdDev(List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0)))
                .isCloseTo(2.138, within(1e-3));
        assertThat(Statistics.sampleStdDev(List.of(5.0))).isEqualTo(0.0);
    }

    @Test
    void pearsonOfPerfectlyInverseSeriesIsMinusOne() {
        assertThat(Statistics.pearson(List.of(1.0, 2.0, 3.0), List.of(30.0, 20.0, 10.0)))
                .isCloseTo(-1.0, within(1e-9));
        assertThatThrownBy(() -> Statistics.pearson(List.of(1.0), List.of(1.0, 2.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
