package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.JobHttpMethod;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.domain.enums.TargetType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for cron job details
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private UUID id;
    private String ownerId;
    private String name;
    private String cronExpression;
    private String cronDescription;
    private String timezone;
    private TargetType targetType;
    private String targetUrl;
    private String command;
    private JobHttpMethod httpMethod;
    private Map<String, String> headers;
    private Map<String, Object> payload;
    private JobStatus status;
    private Integer timeoutMs;
    private Integer maxRetries;

    /**
     * Next fire time; null unless the job is ACTIVE
     */
    private Instant nextExecution;

    private Instant createdAt;
    private Instant updatedAt;
}
