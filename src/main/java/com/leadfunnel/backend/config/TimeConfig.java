package com.leadfunnel.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Provides a single source of truth for time across the app.
 * Always use Clock injection instead of ZonedDateTime.now() / OffsetDateTime.now().
 */
@Configuration
public class TimeConfig {
    @Bean
    public Clock appClock(AdSchedulerProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
