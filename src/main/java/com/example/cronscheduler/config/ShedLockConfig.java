package com.example.cronscheduler.config;

import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Distributed locks for the cron scheduler.
 * <p>
 * {@code @SchedulerLock} guards trigger promotion and the stale delivery sweep
 * so each runs on one instance at a time. The executor takes per-job leases
 * from the same provider when {@code cron-scheduler.worker.serialize-per-job}
 * is on. Delivery claiming itself relies on FOR UPDATE SKIP LOCKED.
 */
@Slf4j
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "${cron-scheduler.lock.default-lock-at-most-for:10m}")
public class ShedLockConfig {

    /**
     * Lock rows live in the job database; expiry is judged by database time
     * so instances with skewed clocks agree on it.
     */
    @Bean
    public LockProvider lockProvider(DataSource dataSource, CronSchedulerProperties properties) {
        var tableName = properties.getLock().getTableName();
        log.info("Using ShedLock table '{}' (locks held at most {})", tableName, properties.getLock().getDefaultLockAtMostFor());

        return new JdbcTemplateLockProvider(
                JdbcTemplateLockProvider.Configuration.builder()
                        .withJdbcTemplate(new JdbcTemplate(dataSource))
                        .withTableName(tableName)
                        .usingDbTime()
                        .build()
        );
    }
}
