package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.enums.JobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for CronJob entity.
 * All user-facing lookups are scoped to the owner.
 */
@Repository
public interface CronJobRepository extends JpaRepository<CronJob, UUID> {

    Page<CronJob> findByOwnerId(String ownerId, Pageable pageable);

    Page<CronJob> findByOwnerIdAndStatus(String ownerId, JobStatus status, Pageable pageable);

    /**
     * Jobs in the given status across all owners, used by startup reconciliation
     */
    List<CronJob> findByStatus(JobStatus status);

    long countByOwnerId(String ownerId);

    long countByOwnerIdAndStatus(String ownerId, JobStatus status);

    long countByStatus(JobStatus status);
}
