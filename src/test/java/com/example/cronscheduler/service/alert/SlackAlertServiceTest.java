package com.example.cronscheduler.service.alert;

import com.example.cronscheduler.config.SlackProperties;
import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.ExecutionLog;
import com.example.cronscheduler.domain.enums.ExecutionStatus;
import com.example.cronscheduler.domain.enums.JobHttpMethod;
import com.example.cronscheduler.domain.enums.TargetType;
import com.slack.api.Slack;
import com.slack.api.webhook.Payload;
import com.slack.api.webhook.WebhookResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlackAlertService Tests")
class SlackAlertServiceTest {

    @Mock
    private Slack slack;

    private SlackProperties slackProperties;
    private SlackAlertService slackAlertService;

    private CronJob job;
    private ExecutionLog executionLog;

    @BeforeEach
    void setUp() {
        slackProperties = new SlackProperties();
        slackAlertService = new SlackAlertService(slackProperties, slack);

        job = CronJob.builder()
                .id(UUID.randomUUID())
                .name("Billing sync")
                .cronExpression("0 * * * *")
                .timezone("UTC")
                .targetType(TargetType.HTTP)
                .httpMethod(JobHttpMethod.POST)
                .targetUrl("https://billing.example.com/sync")
                .build();
        executionLog = ExecutionLog.builder()
                .jobId(job.getId())
                .status(ExecutionStatus.TIMEOUT)
                .attemptNumber(4)
                .errorMessage("Request timed out after 30000ms")
                .build();
    }

    @Test
    @DisplayName("Should not call Slack when alerting is disabled")
    void shouldNotSendWhenDisabled() {
        // When
        slackAlertService.sendDispatchFailureAlert(job, executionLog);

        // Then
        assertThat(slackAlertService.isEnabled()).isFalse();
        verifyNoInteractions(slack);
    }

    @Test
    @DisplayName("Should not be enabled without a webhook URL")
    void shouldRequireWebhookUrl() {
        // Given
        slackProperties.setEnabled(true);
        slackProperties.setWebhookUrl(" ");

        // Then
        assertThat(slackAlertService.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should post the alert to the configured webhook")
    void shouldPostAlert() throws IOException {
        // Given
        slackProperties.setEnabled(true);
        slackProperties.setWebhookUrl("https://hooks.slack.com/services/T/B/X");
        var response = mock(WebhookResponse.class);
        when(response.getCode()).thenReturn(200);
        when(slack.send(eq("https://hooks.slack.com/services/T/B/X"), any(Payload.class))).thenReturn(response);

        // When
        slackAlertService.sendDispatchFailureAlert(job, executionLog);

        // Then
        verify(slack).send(eq("https://hooks.slack.com/services/T/B/X"), any(Payload.class));
    }

    @Test
    @DisplayName("Should keep going when Slack is unreachable")
    void shouldSurviveSlackErrors() throws IOException {
        // Given
        slackProperties.setEnabled(true);
        slackProperties.setWebhookUrl("https://hooks.slack.com/services/T/B/X");
        when(slack.send(anyString(), any(Payload.class))).thenThrow(new IOException("network down"));

        // When / Then
        slackAlertService.sendDispatchFailureAlert(job, executionLog);
    }

    @Test
    @DisplayName("Should describe the failed job in the payload")
    void shouldBuildPayload() {
        // When
        var payload = slackAlertService.buildDispatchFailurePayload(job, executionLog);

        // Then
        assertThat(payload.getChannel()).isEqualTo("#cron-alerts");
        assertThat(payload.getAttachments()).singleElement().satisfies(attachment -> {
            assertThat(attachment.getTitle()).isEqualTo("Billing sync");
            assertThat(attachment.getTitleLink()).endsWith("/api/v1/jobs/" + job.getId());
            assertThat(attachment.getFields())
                    .anySatisfy(field -> assertThat(field.getValue()).isEqualTo("POST https://billing.example.com/sync"))
                    .anySatisfy(field -> assertThat(field.getValue()).isEqualTo("4"))
                    .anySatisfy(field -> assertThat(field.getValue()).contains("Request timed out after 30000ms"));
        });
    }
}
