package com.example.cronscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties.
 * Alerts fire for firings that fail after their last retry.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#cron-alerts";
    private boolean enabled = false;
    private String dashboardBaseUrl = "http://localhost:8080";
}
