package com.example.cronscheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the cron scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "cron-scheduler")
public class CronSchedulerProperties {

    /**
     * Interval in milliseconds between worker polls for deliveries
     */
    @Min(100)
    private long pollIntervalMs = 1000;

    /**
     * Interval in milliseconds between promotions of due repeatable triggers
     */
    @Min(100)
    private long promotionIntervalMs = 1000;

    /**
     * Interval in milliseconds between sweeps for deliveries with expired leases
     */
    @Min(1000)
    private long staleDeliveryCheckIntervalMs = 60000;

    /**
     * Maximum repeatable triggers promoted per queue in one cycle
     */
    @Min(1)
    private int promotionBatchSize = 100;

    /**
     * Time allowed for in-flight deliveries to finish at shutdown
     */
    @NotNull
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    @Valid
    private Worker worker = new Worker();

    @Valid
    private Retention retention = new Retention();

    @Valid
    private Api api = new Api();

    @Valid
    private Lock lock = new Lock();

    @Data
    public static class Worker {

        /**
         * Deliveries processed concurrently per instance
         */
        @Min(1)
        private int concurrency = 10;

        /**
         * How long a claimed delivery stays reserved; must exceed the longest job timeout
         */
        @NotNull
        private Duration lease = Duration.ofMinutes(10);

        /**
         * Skip a firing while a previous firing of the same job is still running
         */
        private boolean serializePerJob = false;

        @Valid
        private RateLimit rateLimit = new RateLimit();
    }

    @Data
    public static class RateLimit {

        private boolean enabled = true;

        /**
         * Dispatches allowed per refresh period
         */
        @Min(1)
        private int limitForPeriod = 100;

        @NotNull
        private Duration refreshPeriod = Duration.ofSeconds(60);

        /**
         * How long a worker waits for a permit before postponing the delivery
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Retention {

        private boolean enabled = true;

        /**
         * Execution logs older than this many days are deleted
         */
        @Min(1)
        private int daysToKeep = 30;

        @NotBlank
        private String cronExpression = "0 3 * * *";

        @NotBlank
        private String timezone = "UTC";
    }

    @Data
    public static class Api {

        @Min(1)
        @Max(100)
        private int defaultPageSize = 20;

        @Min(1)
        @Max(100)
        private int maxPageSize = 100;
    }

    @Data
    public static class Lock {

        /**
         * Table holding ShedLock rows, created by schema.sql
         */
        @NotBlank
        private String tableName = "shedlock";

        /**
         * Upper bound for scheduler locks whose holder dies without releasing them
         */
        @NotBlank
        private String defaultLockAtMostFor = "10m";
    }
}
