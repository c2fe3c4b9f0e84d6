package com.example.cronscheduler.service.queue;

import com.example.cronscheduler.domain.enums.DeliveryKind;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A claimed delivery as seen by a consumer.
 *
 * @param attemptsMade failed attempts before this one
 */
public record QueuedDelivery(
        UUID id,
        String queueName,
        String triggerKey,
        DeliveryKind kind,
        Map<String, Object> payload,
        int attemptsMade,
        int maxAttempts,
        Instant enqueuedAt) {

    /**
     * 1-based number of the attempt now being processed
     */
    public int attemptNumber() {
        return attemptsMade + 1;
    }
}
