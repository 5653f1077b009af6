package com.phillippitts.wfmparity.service.queue;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryBackoffPolicyTest {

    private final RetryBackoffPolicy policy = new RetryBackoffPolicy(Duration.ofSeconds(30), Duration.ofMinutes(30));

    @Test
    void doublesPerRetry() {
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(120));
    }

    @Test
    void capsAtMaximum() {
        assertThat(policy.delayFor(7)).isEqualTo(Duration.ofMinutes(30));
        assertThat(policy.delayFor(1000)).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void nonPositiveRetryUsesBase() {
        assertThat(policy.delayFor(0)).isEqualTo(Duration.ofSeconds(30));
    }
}
