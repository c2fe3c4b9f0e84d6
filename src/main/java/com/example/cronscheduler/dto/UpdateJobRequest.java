package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.JobHttpMethod;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.domain.enums.TargetType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for updating a cron job.
 * Only non-null fields are applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateJobRequest {

    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    private String name;

    private String cronExpression;

    private String timezone;

    private TargetType targetType;

    @Size(max = 2048, message = "Target URL must not exceed 2048 characters")
    private String targetUrl;

    @Size(max = 1000, message = "Command must not exceed 1000 characters")
    private String command;

    private JobHttpMethod httpMethod;

    private Map<String, String> headers;

    private Map<String, Object> payload;

    private JobStatus status;

    @Min(value = 0, message = "Max retries must be at least 0")
    @Max(value = 10, message = "Max retries must not exceed 10")
    private Integer maxRetries;

    @Min(value = 1000, message = "Timeout must be at least 1000ms")
    @Max(value = 300000, message = "Timeout must not exceed 300000ms")
    private Integer timeoutMs;
}
