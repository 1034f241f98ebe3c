package com.matchmate.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * Every timestamp the service writes comes from one UTC clock: session issue and expiry,
 * swipe and match creation, and the audited created_at/updated_at of profiles.
 */
@Configuration
public class TimeConfig {

    public static final String AUDITING_TIME_PROVIDER = "auditingTimeProvider";

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean(AUDITING_TIME_PROVIDER)
    public DateTimeProvider auditingTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock));
    }
}
