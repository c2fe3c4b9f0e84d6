package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.JobHttpMethod;
import com.example.cronscheduler.domain.enums.TargetType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for creating a new cron job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must not exceed 255 characters")
    private String name;

    @NotBlank(message = "Cron expression is required")
    private String cronExpression;

    /**
     * IANA timezone (default: UTC)
     */
    private String timezone;

    @NotNull(message = "Target type is required")
    private TargetType targetType;

    /**
     * Callback URL, required for HTTP jobs
     */
    @Size(max = 2048, message = "Target URL must not exceed 2048 characters")
    private String targetUrl;

    /**
     * Command, required for SCRIPT jobs
     */
    @Size(max = 1000, message = "Command must not exceed 1000 characters")
    private String command;

    /**
     * HTTP method (default: GET)
     */
    private JobHttpMethod httpMethod;

    private Map<String, String> headers;

    /**
     * JSON object sent as the body of POST, PUT and PATCH callbacks
     */
    private Map<String, Object> payload;

    @Min(value = 0, message = "Max retries must be at least 0")
    @Max(value = 10, message = "Max retries must not exceed 10")
    private Integer maxRetries;

    @Min(value = 1000, message = "Timeout must be at least 1000ms")
    @Max(value = 300000, message = "Timeout must not exceed 300000ms")
    private Integer timeoutMs;
}
