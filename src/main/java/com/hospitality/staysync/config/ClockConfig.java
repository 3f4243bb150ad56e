package com.hospitality.staysync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of "now" for timestamps and the daily pull date.
 * <p>
 * The clock runs in the scheduler zone, so the midnight run in that zone
 * computes "tomorrow" from the same calendar day it fired on.
 * Tests replace it with a fixed or mutable clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${pms.sync.scheduler.zone:}") String zone) {
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(zone.trim()));
    }
}
