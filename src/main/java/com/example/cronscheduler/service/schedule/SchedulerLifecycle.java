package com.example.cronscheduler.service.schedule;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.service.queue.TriggerWorker;
import com.example.cronscheduler.service.retention.ExecutionLogRetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Starts and stops scheduling with the application.
 * <p>
 * Startup, before the web server accepts requests:
 * 1. Reconcile repeatable triggers with the active jobs
 * 2. Schedule the daily retention cleanup
 * 3. Start the workers
 * <p>
 * Shutdown, after the web server stopped: workers stop claiming, in-flight
 * deliveries get the grace period to finish, the rest are interrupted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerLifecycle implements SmartLifecycle {

    /**
     * Below the embedded web server's phase: start earlier, stop later
     */
    static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

    private final JobScheduleReconciler reconciler;
    private final ExecutionLogRetentionService retentionService;
    private final List<TriggerWorker> workers;
    private final CronSchedulerProperties properties;

    private volatile boolean running;

    @Override
    public void start() {
        var synced = reconciler.reconcileAll();

        try {
            retentionService.scheduleDailyCleanup();
        } catch (RuntimeException e) {
            log.error("Failed to initialize cleanup job: {}", e.getMessage(), e);
        }

        workers.forEach(TriggerWorker::start);
        running = true;
        log.info("Scheduler started with {} jobs scheduled and {} workers", synced, workers.size());
    }

    @Override
    public void stop() {
        log.info("Shutting down workers...");
        var deadline = System.nanoTime() + properties.getShutdownGracePeriod().toNanos();
        workers.forEach(TriggerWorker::stopClaiming);

        for (var worker : workers) {
            var remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            worker.stop(remaining);
        }

        running = false;
        log.info("Workers stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
