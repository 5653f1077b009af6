package com.phillippitts.wfmparity.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single time source for leases, backoff, retention windows and trend periods.
 *
 * <p>UTC so that calendar dates (trend periods, calculation dates) do not depend on host zone.
 * Tests replace it with a fixed or mutable clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
