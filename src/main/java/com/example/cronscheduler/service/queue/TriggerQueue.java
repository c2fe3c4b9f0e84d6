package com.example.cronscheduler.service.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable queue of repeatable and one-shot triggers.
 * <p>
 * Producers register repeat rules keyed by a stable key; the queue turns
 * each due firing into a delivery. Consumers claim deliveries under a lease
 * and either acknowledge or reject them. Delivery is at-least-once.
 */
public interface TriggerQueue {

    String getName();

    // === Producer side ===

    /**
     * Register (or replace) the repeat rule stored under {@code key}
     */
    void addRepeatable(String key, Map<String, Object> payload, String cronExpression, String timezone, TriggerOptions options);

    default void addRepeatable(String key, Map<String, Object> payload, String cronExpression, String timezone) {
        addRepeatable(key, payload, cronExpression, timezone, TriggerOptions.defaults());
    }

    /**
     * Remove the repeat rule stored under {@code key}
     *
     * @return true if a rule was removed
     */
    boolean removeRepeatable(String key);

    List<RepeatableTriggerView> listRepeatable();

    /**
     * Enqueue a single delivery available immediately
     */
    void addOnce(String key, Map<String, Object> payload, TriggerOptions options);

    default void addOnce(String key, Map<String, Object> payload) {
        addOnce(key, payload, TriggerOptions.defaults());
    }

    // === Consumer side ===

    /**
     * Claim up to {@code limit} available deliveries for {@code workerId}
     */
    List<QueuedDelivery> claim(int limit, String workerId, Duration lease);

    /**
     * Mark a claimed delivery as done; it is removed from the queue
     */
    void acknowledge(QueuedDelivery delivery);

    /**
     * Record a failed attempt; the delivery is redelivered with backoff or marked failed
     */
    void reject(QueuedDelivery delivery, String error);

    /**
     * Hand a claimed delivery back without counting an attempt
     */
    void release(QueuedDelivery delivery, Duration delay);

    // === Maintenance ===

    /**
     * Create deliveries for every repeat rule that is due
     *
     * @return number of deliveries created
     */
    int promoteDueRepeatables(Instant now);

    /**
     * Return deliveries whose lease expired to the pending state
     *
     * @return number of deliveries released
     */
    int releaseStaleDeliveries(Instant now);

    long pendingCount();
}
