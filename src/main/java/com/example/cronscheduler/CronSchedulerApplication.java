package com.example.cronscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cron Scheduler Service Application
 * <p>
 * Lets users register recurring HTTP callbacks (and script placeholders)
 * described by a cron expression and a timezone.
 * <p>
 * Features:
 * - Durable, database-backed trigger queue with repeatable and one-shot triggers
 * - Startup reconciliation of triggers against the active job set
 * - Bounded worker pool with per-job timeout and queue-driven retries
 * - Append-only execution history with daily retention sweep
 * - Owner-scoped job management and statistics API
 */
@EnableScheduling
@SpringBootApplication
public class CronSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronSchedulerApplication.class, args);
    }
}
