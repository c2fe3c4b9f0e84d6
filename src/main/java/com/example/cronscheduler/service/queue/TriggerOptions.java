package com.example.cronscheduler.service.queue;

/**
 * Delivery settings carried by a trigger.
 *
 * @param maxAttempts    total processing attempts before a delivery is marked failed
 * @param backoffDelayMs base delay before the first redelivery, doubled for each further one
 */
public record TriggerOptions(int maxAttempts, long backoffDelayMs) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BACKOFF_DELAY_MS = 2000L;

    public TriggerOptions {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoffDelayMs < 0) {
            throw new IllegalArgumentException("backoffDelayMs must not be negative");
        }
    }

    public static TriggerOptions defaults() {
        return new TriggerOptions(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_DELAY_MS);
    }

    public static TriggerOptions withRetries(int retries) {
        return new TriggerOptions(retries + 1, DEFAULT_BACKOFF_DELAY_MS);
    }
}
