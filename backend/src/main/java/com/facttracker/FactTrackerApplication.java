package com.facttracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Fact Tracker backend.
 *
 * This Spring Boot application provides a REST API for a personal learning
 * tracker, featuring:
 * - A per-user ledger of learned facts stored as JSON on the user row
 * - Daily streak accounting (current and longest streak)
 * - Weekly aggregates computed on every read
 * - Stateless JWT caller identity with per-user ownership checks
 * - PostgreSQL for user records, Redis for cross-instance write locks
 *
 * @version 0.0.1-SNAPSHOT
 */
@SpringBootApplication
public class FactTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactTrackerApplication.class, args);
    }
}
