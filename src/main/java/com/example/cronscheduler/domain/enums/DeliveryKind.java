package com.example.cronscheduler.domain.enums;

/**
 * Origin of a trigger delivery inside the queue.
 */
public enum DeliveryKind {
    /** Materialized from a repeatable trigger when its cron rule came due */
    REPEATABLE,
    /** Enqueued once for immediate processing */
    ONCE
}
