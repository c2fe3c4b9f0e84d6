package com.example.cronscheduler.service.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Drives the trigger queues.
 * <p>
 * Flow:
 * 1. Promotion turns due repeatable triggers into deliveries (one instance at a time via ShedLock)
 * 2. Every instance polls its workers; SKIP LOCKED spreads deliveries across instances
 * 3. A periodic sweep returns deliveries with expired leases to the queue
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriggerPollingService {

    private final List<TriggerQueue> queues;
    private final List<TriggerWorker> workers;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${cron-scheduler.poll-interval-ms:1000}")
    public void pollWorkers() {
        for (var worker : workers) {
            try {
                worker.poll();
            } catch (Exception e) {
                log.error("Error polling queue {}: {}", worker.getQueue().getName(), e.getMessage(), e);
            }
        }
    }

    @Scheduled(fixedDelayString = "${cron-scheduler.promotion-interval-ms:1000}")
    @SchedulerLock(name = "repeatableTriggerPromotion", lockAtMostFor = "1m")
    public void promoteDueTriggers() {
        var now = clock.instant();
        for (var queue : queues) {
            try {
                queue.promoteDueRepeatables(now);
            } catch (Exception e) {
                log.error("Error promoting repeatable triggers on queue {}: {}", queue.getName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Deliveries can hold an expired lease if:
     * - The instance crashed while processing
     * - The worker was force-stopped at shutdown
     */
    @Scheduled(fixedDelayString = "${cron-scheduler.stale-delivery-check-interval-ms:60000}")
    @SchedulerLock(name = "staleDeliveryRelease", lockAtLeastFor = "5s", lockAtMostFor = "5m")
    public void releaseStaleDeliveries() {
        var now = clock.instant();
        for (var queue : queues) {
            try {
                queue.releaseStaleDeliveries(now);
            } catch (Exception e) {
                log.error("Error releasing stale deliveries on queue {}: {}", queue.getName(), e.getMessage(), e);
            }
        }
    }
}
