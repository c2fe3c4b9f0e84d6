package com.example.cronscheduler.controller;

import com.example.cronscheduler.domain.enums.ExecutionStatus;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.dto.*;
import com.example.cronscheduler.service.ExecutionLogService;
import com.example.cronscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API controller for cron job management.
 * <p>
 * Provides endpoints for:
 * - Creating, reading, updating and deleting jobs
 * - Pausing, resuming and running jobs immediately
 * - Execution history and statistics of a single job
 * <p>
 * Every endpoint is scoped to the user in the X-User-Id header.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Cron Jobs", description = "APIs for managing recurring jobs")
public class JobController {

    private final JobManagementService jobManagementService;
    private final ExecutionLogService executionLogService;

    // === Job Creation ===

    @PostMapping
    @Operation(summary = "Create a cron job", description = "Create a job that fires on its cron schedule")
    public ResponseEntity<ApiResponse<JobResponse>> createJob(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody CreateJobRequest request) {
        log.info("API: Create job request '{}' from user {}", request.getName(), userId);

        var response = jobManagementService.createJob(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Cron job created successfully"));
    }

    // === Job Retrieval ===

    @GetMapping
    @Operation(summary = "List jobs", description = "List the caller's jobs, newest first")
    public ResponseEntity<ApiResponse<PagedResponse<JobResponse>>> listJobs(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Status filter") @RequestParam(required = false) JobStatus status,
            @Parameter(description = "Page number (0-based)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size, at most 100") @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.listJobs(userId, status, page, size)));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job by ID")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId) {

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJob(userId, jobId)));
    }

    // === Job Modification ===

    @PutMapping("/{jobId}")
    @Operation(summary = "Update a job", description = "Apply the fields present in the request")
    public ResponseEntity<ApiResponse<JobResponse>> updateJob(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Valid @RequestBody UpdateJobRequest request) {
        log.info("API: Update job {} from user {}", jobId, userId);

        var response = jobManagementService.updateJob(userId, jobId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Cron job updated successfully"));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete a job", description = "Unschedule and delete the job; its execution logs are kept until retention")
    public ResponseEntity<ApiResponse<Void>> deleteJob(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Delete job {} from user {}", jobId, userId);

        jobManagementService.deleteJob(userId, jobId);
        return ResponseEntity.ok(ApiResponse.success(null, "Cron job deleted successfully"));
    }

    @PostMapping("/{jobId}/pause")
    @Operation(summary = "Pause a job")
    public ResponseEntity<ApiResponse<JobResponse>> pauseJob(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Pause job {} from user {}", jobId, userId);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.pauseJob(userId, jobId), "Cron job paused"));
    }

    @PostMapping("/{jobId}/resume")
    @Operation(summary = "Resume a paused job")
    public ResponseEntity<ApiResponse<JobResponse>> resumeJob(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Resume job {} from user {}", jobId, userId);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.resumeJob(userId, jobId), "Cron job resumed"));
    }

    @PostMapping("/{jobId}/run")
    @Operation(summary = "Run a job now", description = "Queue one firing immediately, outside the schedule")
    public ResponseEntity<ApiResponse<Void>> runJobNow(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Run job {} now from user {}", jobId, userId);

        jobManagementService.runJobNow(userId, jobId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(null, "Cron job queued for immediate execution"));
    }

    // === History & Statistics ===

    @GetMapping("/{jobId}/logs")
    @Operation(summary = "List executions of a job", description = "Execution history, newest first")
    public ResponseEntity<ApiResponse<PagedResponse<ExecutionLogResponse>>> listExecutions(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Parameter(description = "Status filter") @RequestParam(required = false) ExecutionStatus status,
            @Parameter(description = "Page number (0-based)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size, at most 100") @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.success(executionLogService.listExecutions(userId, jobId, status, page, size)));
    }

    @GetMapping("/{jobId}/stats")
    @Operation(summary = "Get job statistics")
    public ResponseEntity<ApiResponse<JobStatistics>> getJobStatistics(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Job UUID") @PathVariable UUID jobId) {

        return ResponseEntity.ok(ApiResponse.success(executionLogService.getJobStatistics(userId, jobId)));
    }
}
