package com.example.cronscheduler.service.queue;

/**
 * Processes deliveries claimed from a trigger queue.
 * <p>
 * Returning normally acknowledges the delivery. Throwing rejects it, and the
 * queue redelivers with backoff while the delivery has attempts left.
 */
@FunctionalInterface
public interface TriggerConsumer {

    void consume(QueuedDelivery delivery) throws Exception;
}
