package com.phillippitts.wfmparity.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityTest {

    @Test
    void averageDeviationThresholdsAreExclusive() {
        assertThat(Severity.forAverageDeviation(12.0)).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.forAverageDeviation(15.0)).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.forAverageDeviation(15.1)).isEqualTo(Severity.HIGH);
        assertThat(Severity.forAverageDeviation(25.0)).isEqualTo(Severity.HIGH);
        assertThat(Severity.forAverageDeviation(30.0)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void mapsIssueSeverity() {
        assertThat(Severity.forIssueSeverity(IssueSeverity.INFO)).isEqualTo(Severity.LOW);
        assertThat(Severity.forIssueSeverity(IssueSeverity.WARNING)).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.forIssueSeverity(IssueSeverity.ERROR)).isEqualTo(Severity.HIGH);
        assertThat(Severity.forIssueSeverity(IssueSeverity.CRITICAL)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void issueSeverityDefaultsToWarning() {
        assertThat(IssueSeverity.fromCode(null)).isEqualTo(IssueSeverity.WARNING);
        assertThat(IssueSeverity.fromCode(" error ")).isEqualTo(IssueSeverity.ERROR);
    }
}
