package com.hospitality.staysync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Stay Sync Service
 * <p>
 * Keeps stays and guests in our store in line with the Property Management
 * Systems (PMS) our hotels run on (e.g., Mews).
 * <p>
 * Key Features:
 * - Webhook-driven sync of single reservations
 * - Daily pull of tomorrow's check-ins
 * - Bounded retry of flaky vendor API calls
 * - Idempotent guest and stay upserts
 */
@SpringBootApplication
@EnableScheduling
public class StaySyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(StaySyncApplication.class, args);
    }
}
