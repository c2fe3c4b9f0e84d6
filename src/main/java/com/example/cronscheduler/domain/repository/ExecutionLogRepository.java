package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.ExecutionLog;
import com.example.cronscheduler.domain.enums.ExecutionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for ExecutionLog entity.
 * <p>
 * Logs are append-only: the only write besides insert is the retention delete.
 * Owner-scoped queries join through the owning job, so logs of deleted jobs
 * are visible only until retention removes them from the table.
 */
@Repository
public interface ExecutionLogRepository extends JpaRepository<ExecutionLog, UUID> {

    Page<ExecutionLog> findByJobId(UUID jobId, Pageable pageable);

    Page<ExecutionLog> findByJobIdAndStatus(UUID jobId, ExecutionStatus status, Pageable pageable);

    List<ExecutionLog> findTop5ByJobIdOrderByStartedAtDesc(UUID jobId);

    long countByJobId(UUID jobId);

    long countByJobIdAndStatus(UUID jobId, ExecutionStatus status);

    /**
     * Average duration of all attempts of a job, null when there are none
     */
    @Query("SELECT AVG(l.durationMs) FROM ExecutionLog l WHERE l.jobId = :jobId")
    Double averageDurationByJobId(@Param("jobId") UUID jobId);

    /**
     * Logs of every job owned by the user
     */
    @Query(value = """
            SELECT l FROM ExecutionLog l
            WHERE l.jobId IN (SELECT j.id FROM CronJob j WHERE j.ownerId = :ownerId)
            """,
            countQuery = """
                    SELECT COUNT(l) FROM ExecutionLog l
                    WHERE l.jobId IN (SELECT j.id FROM CronJob j WHERE j.ownerId = :ownerId)
                    """)
    Page<ExecutionLog> findByOwnerId(@Param("ownerId") String ownerId, Pageable pageable);

    @Query("""
            SELECT COUNT(l) FROM ExecutionLog l
            WHERE l.jobId IN (SELECT j.id FROM CronJob j WHERE j.ownerId = :ownerId)
            """)
    long countByOwnerId(@Param("ownerId") String ownerId);

    @Query("""
            SELECT COUNT(l) FROM ExecutionLog l
            WHERE l.status = :status
              AND l.jobId IN (SELECT j.id FROM CronJob j WHERE j.ownerId = :ownerId)
            """)
    long countByOwnerIdAndStatus(@Param("ownerId") String ownerId, @Param("status") ExecutionStatus status);

    /**
     * Delete logs whose attempt started before the cutoff (retention)
     *
     * @return number of rows deleted
     */
    @Modifying
    @Query("DELETE FROM ExecutionLog l WHERE l.startedAt < :cutoff")
    int deleteByStartedAtBefore(@Param("cutoff") Instant cutoff);
}
