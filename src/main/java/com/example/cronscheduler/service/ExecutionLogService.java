package com.example.cronscheduler.service;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.ExecutionLog;
import com.example.cronscheduler.domain.enums.ExecutionStatus;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.domain.repository.CronJobRepository;
import com.example.cronscheduler.domain.repository.ExecutionLogRepository;
import com.example.cronscheduler.dto.ExecutionLogResponse;
import com.example.cronscheduler.dto.JobStatistics;
import com.example.cronscheduler.dto.PagedResponse;
import com.example.cronscheduler.dto.UserStatistics;
import com.example.cronscheduler.exception.ExecutionLogNotFoundException;
import com.example.cronscheduler.exception.JobAccessDeniedException;
import com.example.cronscheduler.mapper.JobMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the execution history: listings and statistics.
 * Every query is scoped to jobs the caller owns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLogService {

    static final int JOB_RECENT_COUNT = 5;
    static final int USER_RECENT_COUNT = 10;

    private final ExecutionLogRepository executionLogRepository;
    private final CronJobRepository jobRepository;
    private final JobManagementService jobManagementService;
    private final JobMapper jobMapper;
    private final CronSchedulerProperties properties;

    /**
     * Execution history of one job, newest first
     */
    @Transactional(readOnly = true)
    public PagedResponse<ExecutionLogResponse> listExecutions(String ownerId, UUID jobId, ExecutionStatus status, int page, int size) {
        var job = jobManagementService.getOwnedJob(ownerId, jobId);
        var pageable = newestFirst(page, size);

        var logs = status != null
                ? executionLogRepository.findByJobIdAndStatus(jobId, status, pageable)
                : executionLogRepository.findByJobId(jobId, pageable);

        return PagedResponse.of(logs.map(l -> withJobName(l, job.getName())));
    }

    /**
     * Execution history across all jobs of the user, newest first
     */
    @Transactional(readOnly = true)
    public PagedResponse<ExecutionLogResponse> listUserExecutions(String ownerId, int page, int size) {
        var logs = executionLogRepository.findByOwnerId(ownerId, newestFirst(page, size));
        var names = jobNames(logs.getContent());
        return PagedResponse.of(logs.map(l -> withJobName(l, names.get(l.getJobId()))));
    }

    @Transactional(readOnly = true)
    public ExecutionLogResponse getExecutionById(String ownerId, UUID logId) {
        var executionLog = executionLogRepository.findById(logId).orElseThrow(() -> new ExecutionLogNotFoundException(logId));

        // Logs of deleted jobs have no owner left to check against
        var job = jobRepository.findById(executionLog.getJobId()).orElseThrow(() -> new ExecutionLogNotFoundException(logId));
        if (!job.isOwnedBy(ownerId)) {
            log.warn("User {} attempted to read execution log {} of another user's job", ownerId, logId);
            throw new JobAccessDeniedException(job.getId(), ownerId);
        }

        return withJobName(executionLog, job.getName());
    }

    // === Statistics ===

    @Transactional(readOnly = true)
    public JobStatistics getJobStatistics(String ownerId, UUID jobId) {
        var job = jobManagementService.getOwnedJob(ownerId, jobId);

        var total = executionLogRepository.countByJobId(jobId);
        var successful = executionLogRepository.countByJobIdAndStatus(jobId, ExecutionStatus.SUCCESS);
        var failed = executionLogRepository.countByJobIdAndStatus(jobId, ExecutionStatus.FAILED)
                + executionLogRepository.countByJobIdAndStatus(jobId, ExecutionStatus.TIMEOUT);
        var average = executionLogRepository.averageDurationByJobId(jobId);

        var recent = executionLogRepository.findTop5ByJobIdOrderByStartedAtDesc(jobId).stream()
                .map(l -> withJobName(l, job.getName()))
                .toList();

        return JobStatistics.builder()
                .jobId(jobId)
                .totalExecutions(total)
                .successfulExecutions(successful)
                .failedExecutions(failed)
                .successRate(successRate(successful, total))
                .averageDurationMs(average != null ? Math.round(average) : null)
                .recentExecutions(recent)
                .build();
    }

    @Transactional(readOnly = true)
    public UserStatistics getUserStatistics(String ownerId) {
        var jobs = UserStatistics.JobCounts.builder()
                .total(jobRepository.countByOwnerId(ownerId))
                .active(jobRepository.countByOwnerIdAndStatus(ownerId, JobStatus.ACTIVE))
                .paused(jobRepository.countByOwnerIdAndStatus(ownerId, JobStatus.PAUSED))
                .build();

        var total = executionLogRepository.countByOwnerId(ownerId);
        var successful = executionLogRepository.countByOwnerIdAndStatus(ownerId, ExecutionStatus.SUCCESS);
        var failed = executionLogRepository.countByOwnerIdAndStatus(ownerId, ExecutionStatus.FAILED)
                + executionLogRepository.countByOwnerIdAndStatus(ownerId, ExecutionStatus.TIMEOUT);

        var executions = UserStatistics.ExecutionCounts.builder()
                .total(total)
                .successful(successful)
                .failed(failed)
                .successRate(successRate(successful, total))
                .build();

        var recentLogs = executionLogRepository.findByOwnerId(ownerId,
                PageRequest.of(0, USER_RECENT_COUNT, Sort.by(Sort.Direction.DESC, "startedAt"))).getContent();
        var names = jobNames(recentLogs);
        var recent = recentLogs.stream().map(l -> withJobName(l, names.get(l.getJobId()))).toList();

        return UserStatistics.builder()
                .jobs(jobs)
                .executions(executions)
                .recentExecutions(recent)
                .build();
    }

    /**
     * Percentage with two decimals; 0 when nothing ran
     */
    static double successRate(long successful, long total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(successful * 100.0 / total).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private ExecutionLogResponse withJobName(ExecutionLog executionLog, String jobName) {
        var response = jobMapper.toLogResponse(executionLog);
        response.setJobName(jobName);
        return response;
    }

    private Map<UUID, String> jobNames(List<ExecutionLog> logs) {
        var ids = logs.stream().map(ExecutionLog::getJobId).collect(Collectors.toSet());
        return jobRepository.findAllById(ids).stream().collect(Collectors.toMap(CronJob::getId, CronJob::getName, (a, b) -> a));
    }

    private Pageable newestFirst(int page, int size) {
        var api = properties.getApi();
        var pageSize = size <= 0 ? api.getDefaultPageSize() : Math.min(size, api.getMaxPageSize());
        return PageRequest.of(Math.max(page, 0), pageSize, Sort.by(Sort.Direction.DESC, "startedAt"));
    }
}
