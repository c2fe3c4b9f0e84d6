package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.TriggerDelivery;
import com.example.cronscheduler.domain.enums.DeliveryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for trigger deliveries.
 * <p>
 * Uses PostgreSQL FOR UPDATE SKIP LOCKED so each pending delivery is
 * handed to at most one worker across all instances.
 */
@Repository
public interface TriggerDeliveryRepository extends JpaRepository<TriggerDelivery, UUID> {

    /**
     * Pending deliveries of a queue that are available now, oldest first
     */
    @Query(value = """
            SELECT d.* FROM trigger_deliveries d
            WHERE d.queue_name = :queueName
              AND d.status = 'PENDING'
              AND d.available_at <= :now
            ORDER BY d.available_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<TriggerDelivery> findClaimable(@Param("queueName") String queueName, @Param("now") Instant now, @Param("limit") int limit);

    /**
     * Return deliveries whose lease expired to the pending state.
     * These were held by a worker that crashed or stalled.
     *
     * @return number of deliveries released
     */
    @Modifying
    @Query("""
            UPDATE TriggerDelivery d
            SET d.status = com.example.cronscheduler.domain.enums.DeliveryStatus.PENDING,
                d.lockedBy = NULL,
                d.lockedUntil = NULL,
                d.availableAt = :now,
                d.lastError = 'Lease expired before the delivery was acknowledged',
                d.updatedAt = :now
            WHERE d.queueName = :queueName
              AND d.status = com.example.cronscheduler.domain.enums.DeliveryStatus.PROCESSING
              AND d.lockedUntil < :now
            """)
    int releaseExpiredLeases(@Param("queueName") String queueName, @Param("now") Instant now);

    long countByQueueNameAndStatus(String queueName, DeliveryStatus status);

    List<TriggerDelivery> findByQueueNameAndTriggerKey(String queueName, String triggerKey);
}
