package com.example.cronscheduler.service.queue;

import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Binds a {@link TriggerQueue} to a {@link TriggerConsumer}.
 * <p>
 * Each poll claims at most as many deliveries as there are free slots, so no
 * more than {@code concurrency} deliveries are in flight. An optional rate
 * limiter caps how many deliveries start per refresh period; deliveries that
 * cannot get a permit go back to the queue without losing an attempt.
 */
@Slf4j
public class TriggerWorker {

    private static final Duration RATE_LIMITED_REDELIVERY_DELAY = Duration.ofSeconds(1);

    @Getter
    private final String name;
    @Getter
    private final TriggerQueue queue;
    private final TriggerConsumer consumer;
    @Getter
    private final int concurrency;
    private final RateLimiter rateLimiter;
    private final String workerId;
    private final Duration lease;

    private final Semaphore slots;
    private final ThreadPoolExecutor executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TriggerWorker(String name, TriggerQueue queue, TriggerConsumer consumer, int concurrency,
                         RateLimiter rateLimiter, String workerId, Duration lease) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Worker concurrency must be at least 1");
        }
        this.name = name;
        this.queue = queue;
        this.consumer = consumer;
        this.concurrency = concurrency;
        this.rateLimiter = rateLimiter;
        this.workerId = workerId;
        this.lease = lease;
        this.slots = new Semaphore(concurrency);
        this.executor = new ThreadPoolExecutor(concurrency, concurrency, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new CustomizableThreadFactory(name + "-worker-"));
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("[{}] Worker started on queue {} with concurrency {}{}", name, queue.getName(), concurrency,
                    rateLimiter != null ? ", rate limit " + rateLimiter.getRateLimiterConfig().getLimitForPeriod()
                            + " per " + rateLimiter.getRateLimiterConfig().getLimitRefreshPeriod() : "");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Number of deliveries currently being processed
     */
    public int inFlight() {
        return concurrency - slots.availablePermits();
    }

    /**
     * Claim available deliveries into free slots and hand them to the consumer
     *
     * @return number of deliveries claimed
     */
    public int poll() {
        if (!running.get()) {
            return 0;
        }

        var free = slots.availablePermits();
        if (free == 0) {
            log.trace("[{}] All {} slots busy, skipping poll", name, concurrency);
            return 0;
        }

        var claimed = queue.claim(free, workerId, lease);
        for (var delivery : claimed) {
            if (!slots.tryAcquire()) {
                queue.release(delivery, Duration.ZERO);
                continue;
            }
            try {
                executor.execute(() -> process(delivery));
            } catch (RejectedExecutionException e) {
                slots.release();
                log.warn("[{}] Worker is shutting down, returning delivery {} to the queue", name, delivery.id());
                queue.release(delivery, Duration.ZERO);
            }
        }

        if (!claimed.isEmpty()) {
            log.debug("[{}] Claimed {} deliveries", name, claimed.size());
        }
        return claimed.size();
    }

    private void process(QueuedDelivery delivery) {
        try {
            if (rateLimiter != null && !rateLimiter.acquirePermission()) {
                log.debug("[{}] Rate limit reached, delivery {} postponed", name, delivery.id());
                queue.release(delivery, RATE_LIMITED_REDELIVERY_DELAY);
                return;
            }

            try {
                consumer.consume(delivery);
            } catch (Exception e) {
                log.warn("[{}] Delivery {} for {} failed on attempt {}: {}",
                        name, delivery.id(), delivery.triggerKey(), delivery.attemptNumber(), e.getMessage());
                queue.reject(delivery, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                return;
            }

            queue.acknowledge(delivery);
        } catch (RuntimeException e) {
            // The lease expires and the stale sweep hands the delivery out again
            log.error("[{}] Could not settle delivery {}: {}", name, delivery.id(), e.getMessage(), e);
        } finally {
            slots.release();
        }
    }

    /**
     * Stop claiming new deliveries; in-flight deliveries keep running
     */
    public void stopClaiming() {
        running.set(false);
        executor.shutdown();
    }

    /**
     * Stop claiming and wait for in-flight deliveries up to {@code gracePeriod}.
     * Deliveries still running afterwards are interrupted.
     *
     * @return true if all in-flight work finished in time
     */
    public boolean stop(Duration gracePeriod) {
        stopClaiming();

        try {
            if (executor.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("[{}] Worker stopped", name);
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        var abandoned = executor.shutdownNow();
        log.error("[{}] Forced shutdown after timeout, {} deliveries still in flight, {} not started",
                name, inFlight(), abandoned.size());
        return false;
    }
}
