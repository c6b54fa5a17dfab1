package com.facttracker.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Reference clock for fact timestamps and streak days.
 *
 * All calendar decisions (today, yesterday, the weekly window) use the zone
 * of this clock, set by {@code app.clock.zone} (default UTC).
 */
@Configuration
@Slf4j
public class ClockConfig {

    @Value("${app.clock.zone:UTC}")
    private String zone;

    @Bean
    public Clock clock() {
        ZoneId zoneId = ZoneId.of(zone);
        log.info("Reference clock zone: {}", zoneId);
        return Clock.system(zoneId);
    }
}
