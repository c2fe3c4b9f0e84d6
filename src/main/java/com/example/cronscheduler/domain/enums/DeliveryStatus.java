package com.example.cronscheduler.domain.enums;

/**
 * State of a trigger delivery in the queue.
 * Acknowledged deliveries are removed, so there is no completed state.
 */
public enum DeliveryStatus {

    /**
     * Waiting to be claimed once {@code availableAt} has passed.
     */
    PENDING,

    /**
     * Claimed by a worker that holds the lease.
     */
    PROCESSING,

    /**
     * Rejected more times than its attempt budget allows.
     * Kept for inspection, never redelivered.
     */
    FAILED
}
