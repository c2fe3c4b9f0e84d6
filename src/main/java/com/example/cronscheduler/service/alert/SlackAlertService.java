package com.example.cronscheduler.service.alert;

import com.example.cronscheduler.config.SlackProperties;
import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.ExecutionLog;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Sends alerts to Slack when a firing fails after its last retry.
 * <p>
 * Disabled unless {@code slack.enabled} is set and a webhook URL is configured.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:cron-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    public boolean isEnabled() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    /**
     * Alert for a firing whose transport failed on every allowed attempt.
     * Runs asynchronously to not block the worker.
     */
    @Async
    public void sendDispatchFailureAlert(CronJob job, ExecutionLog executionLog) {
        if (!isEnabled()) {
            log.debug("Slack alerting disabled, no alert for job {} terminal failure", job.getId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildDispatchFailurePayload(job, executionLog));
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for job {} terminal failure", job.getId());
            }
        } catch (IOException e) {
            log.error("Error sending Slack alert for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    Payload buildDispatchFailurePayload(CronJob job, ExecutionLog executionLog) {
        var jobId = job.getId().toString();
        var target = job.getTargetUrl() != null ? job.getHttpMethod() + " " + job.getTargetUrl() : job.getTargetType().getDisplayName();
        var error = executionLog.getErrorMessage() != null ? executionLog.getErrorMessage() : "Unknown error";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Cron Job Failed After All Retries*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(job.getName())
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/api/v1/jobs/" + jobId)
                                .fields(List.of(
                                        Field.builder()
                                                .title("Job ID")
                                                .value(jobId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Status")
                                                .value(executionLog.getStatus().getDisplayName())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Attempts")
                                                .value(String.valueOf(executionLog.getAttemptNumber()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Target")
                                                .value(truncate(target, 200))
                                                .valueShortEnough(false)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(error, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | " + job.getCronExpression() + " " + job.getTimezone())
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
