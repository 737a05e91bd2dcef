package com.magicminds.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Single UTC clock for presence stamps, join-request decisions, the signing-key cache and entity auditing.
 */
@Configuration
@EnableJpaAuditing(dateTimeProviderRef = "auditTimestamps")
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Truncated to microseconds, the precision of {@code timestamptz}, so a response built right after a
     * flush shows the same instant a later read returns.
     */
    @Bean
    public DateTimeProvider auditTimestamps(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS));
    }
}
