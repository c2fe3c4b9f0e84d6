package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.RepeatableTrigger;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for repeatable triggers.
 * <p>
 * Due triggers are selected with FOR UPDATE SKIP LOCKED so concurrent
 * promoters never materialize the same firing twice.
 */
@Repository
public interface RepeatableTriggerRepository extends JpaRepository<RepeatableTrigger, UUID> {

    Optional<RepeatableTrigger> findByQueueNameAndTriggerKey(String queueName, String triggerKey);

    List<RepeatableTrigger> findByQueueNameOrderByTriggerKeyAsc(String queueName);

    /**
     * Triggers of a queue whose next fire time has passed, locked for promotion
     */
    @Query(value = """
            SELECT r.* FROM repeatable_triggers r
            WHERE r.queue_name = :queueName
              AND r.next_fire_at <= :now
            ORDER BY r.next_fire_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<RepeatableTrigger> findDueForUpdate(@Param("queueName") String queueName, @Param("now") Instant now, @Param("limit") int limit);

    @Modifying
    @Query("DELETE FROM RepeatableTrigger r WHERE r.queueName = :queueName AND r.triggerKey = :triggerKey")
    int deleteByQueueNameAndTriggerKey(@Param("queueName") String queueName, @Param("triggerKey") String triggerKey);
}
