package com.example.cronscheduler.service.executor;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.ExecutionLog;
import com.example.cronscheduler.domain.enums.DeliveryKind;
import com.example.cronscheduler.domain.enums.ExecutionStatus;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.domain.enums.TargetType;
import com.example.cronscheduler.domain.enums.TriggerSource;
import com.example.cronscheduler.domain.repository.CronJobRepository;
import com.example.cronscheduler.domain.repository.ExecutionLogRepository;
import com.example.cronscheduler.exception.DispatchTimeoutException;
import com.example.cronscheduler.exception.DispatchTransportException;
import com.example.cronscheduler.service.alert.SlackAlertService;
import com.example.cronscheduler.service.dispatch.DispatchHandler;
import com.example.cronscheduler.service.dispatch.DispatchHandlerRegistry;
import com.example.cronscheduler.service.dispatch.DispatchResult;
import com.example.cronscheduler.service.dispatch.ScriptDispatchHandler;
import com.example.cronscheduler.service.queue.QueuedDelivery;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobExecutionService Tests")
class JobExecutionServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:05:00Z");

    @Mock
    private CronJobRepository jobRepository;

    @Mock
    private ExecutionLogRepository executionLogRepository;

    @Mock
    private DispatchHandlerRegistry handlerRegistry;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private LockProvider lockProvider;

    @Mock
    private DispatchHandler handler;

    @Captor
    private ArgumentCaptor<ExecutionLog> logCaptor;

    private CronSchedulerProperties properties;
    private JobExecutionService executionService;

    private UUID jobId;
    private CronJob job;

    @BeforeEach
    void setUp() {
        properties = new CronSchedulerProperties();
        executionService = new JobExecutionService(jobRepository, executionLogRepository, handlerRegistry, slackAlertService,
                metricsConfig, properties, lockProvider, Clock.fixed(NOW, ZoneOffset.UTC));

        jobId = UUID.randomUUID();
        job = CronJob.builder()
                .id(jobId)
                .ownerId("user-1")
                .name("Ping")
                .cronExpression("*/5 * * * *")
                .targetType(TargetType.HTTP)
                .targetUrl("https://example.com/hook")
                .status(JobStatus.ACTIVE)
                .timeoutMs(5000)
                .maxRetries(2)
                .build();
    }

    private QueuedDelivery delivery(int attemptsMade) {
        return delivery(DeliveryKind.REPEATABLE, attemptsMade);
    }

    private QueuedDelivery delivery(DeliveryKind kind, int attemptsMade) {
        return new QueuedDelivery(UUID.randomUUID(), "cron-jobs", jobId.toString(), kind,
                Map.of("jobId", jobId.toString()), attemptsMade, 3, NOW);
    }

    private void givenActiveHttpJob() {
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(handlerRegistry.getHandlerOrThrow(TargetType.HTTP)).thenReturn(handler);
    }

    private void givenSavedLogsReturned() {
        when(executionLogRepository.save(any(ExecutionLog.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("Skipped firings")
    class SkippedFiringTests {

        @Test
        @DisplayName("Should skip a firing for a deleted job without recording anything")
        void shouldSkipDeletedJob() {
            // Given
            when(jobRepository.findById(jobId)).thenReturn(Optional.empty());

            // When
            var result = executionService.execute(delivery(0));

            // Then
            assertThat(result).isEmpty();
            verify(executionLogRepository, never()).save(any());
            verify(handlerRegistry, never()).getHandlerOrThrow(any());
            verify(metricsConfig).recordSkipped("not_found");
        }

        @Test
        @DisplayName("Should skip a firing for a paused job")
        void shouldSkipPausedJob() {
            // Given
            job.setStatus(JobStatus.PAUSED);
            when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));

            // When
            var result = executionService.execute(delivery(0));

            // Then
            assertThat(result).isEmpty();
            verify(executionLogRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should drop a delivery without a job id")
        void shouldDropDeliveryWithoutJobId() {
            // Given
            var delivery = new QueuedDelivery(UUID.randomUUID(), "cron-jobs", "x", DeliveryKind.REPEATABLE,
                    Map.of("jobId", "not-a-uuid"), 0, 3, NOW);

            // When
            var result = executionService.execute(delivery);

            // Then
            assertThat(result).isEmpty();
            verifyNoInteractions(jobRepository, executionLogRepository);
        }

        @Test
        @DisplayName("Should not throw from consume for a deleted job so the delivery is acknowledged")
        void shouldConsumeDeletedJobQuietly() throws Exception {
            // Given
            when(jobRepository.findById(jobId)).thenReturn(Optional.empty());

            // When / Then
            executionService.consume(delivery(0));
        }
    }

    @Nested
    @DisplayName("Completed dispatches")
    class CompletedDispatchTests {

        @Test
        @DisplayName("Should record a successful dispatch")
        void shouldRecordSuccess() {
            // Given
            givenActiveHttpJob();
            givenSavedLogsReturned();
            when(handler.dispatch(job)).thenReturn(DispatchResult.fromResponse(200, "ok"));

            // When
            var result = executionService.execute(delivery(0));

            // Then
            assertThat(result).isPresent();
            var executionLog = result.get();
            assertThat(executionLog.getJobId()).isEqualTo(jobId);
            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
            assertThat(executionLog.getResponseCode()).isEqualTo(200);
            assertThat(executionLog.getResponseBody()).isEqualTo("ok");
            assertThat(executionLog.getAttemptNumber()).isEqualTo(1);
            assertThat(executionLog.getTriggerSource()).isEqualTo(TriggerSource.SCHEDULED);
            assertThat(executionLog.getStartedAt()).isEqualTo(NOW);
            assertThat(executionLog.getDurationMs()).isZero();
            verify(slackAlertService, never()).sendDispatchFailureAlert(any(), any());
        }

        @Test
        @DisplayName("Should record a non-2xx response as FAILED without retrying")
        void shouldRecordHttpErrorWithoutRetry() {
            // Given
            givenActiveHttpJob();
            givenSavedLogsReturned();
            when(handler.dispatch(job)).thenReturn(DispatchResult.fromResponse(500, "boom"));

            // When
            var result = executionService.execute(delivery(0));

            // Then
            assertThat(result).get().satisfies(executionLog -> {
                assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.FAILED);
                assertThat(executionLog.getResponseCode()).isEqualTo(500);
                assertThat(executionLog.getErrorType()).isEqualTo("HTTP_500");
            });
            verify(executionLogRepository, times(1)).save(any());
            verify(slackAlertService, never()).sendDispatchFailureAlert(any(), any());
        }

        @Test
        @DisplayName("Should mark manual runs as MANUAL")
        void shouldMarkManualRuns() {
            // Given
            givenActiveHttpJob();
            givenSavedLogsReturned();
            when(handler.dispatch(job)).thenReturn(DispatchResult.fromResponse(204, ""));

            // When
            var result = executionService.execute(delivery(DeliveryKind.ONCE, 0));

            // Then
            assertThat(result).get().extracting(ExecutionLog::getTriggerSource).isEqualTo(TriggerSource.MANUAL);
        }

        @Test
        @DisplayName("Should record script jobs as failed without running them")
        void shouldRecordScriptJobAsFailed() {
            // Given
            job.setTargetType(TargetType.SCRIPT);
            job.setCommand("echo hello");
            when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
            when(handlerRegistry.getHandlerOrThrow(TargetType.SCRIPT)).thenReturn(new ScriptDispatchHandler());
            givenSavedLogsReturned();

            // When
            var result = executionService.execute(delivery(0));

            // Then
            assertThat(result).get().satisfies(executionLog -> {
                assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.FAILED);
                assertThat(executionLog.getErrorMessage()).isEqualTo("Script execution not implemented");
                assertThat(executionLog.getResponseBody()).isEqualTo("Script execution is disabled for security reasons");
            });
        }
    }

    @Nested
    @DisplayName("Transport failures")
    class TransportFailureTests {

        @Test
        @DisplayName("Should rethrow while retries are left and record one FAILED log at the end")
        void shouldRetryThenRecordOneFailure() {
            // Given
            givenActiveHttpJob();
            givenSavedLogsReturned();
            when(handler.dispatch(job)).thenThrow(new DispatchTransportException(job.getTargetUrl(), "Connection refused", null));

            // When
            var rethrown = 0;
            Optional<ExecutionLog> terminal = Optional.empty();
            for (var attemptsMade = 0; attemptsMade < 3; attemptsMade++) {
                try {
                    terminal = executionService.execute(delivery(attemptsMade));
                } catch (DispatchTransportException e) {
                    rethrown++;
                }
            }

            // Then
            assertThat(rethrown).isEqualTo(2);
            verify(handler, times(3)).dispatch(job);
            verify(executionLogRepository, times(1)).save(logCaptor.capture());
            var executionLog = logCaptor.getValue();
            assertThat(terminal).contains(executionLog);
            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(executionLog.getAttemptNumber()).isEqualTo(3);
            assertThat(executionLog.getErrorMessage()).isEqualTo("Connection refused");
            verify(slackAlertService).sendDispatchFailureAlert(job, executionLog);
            verify(metricsConfig, times(2)).recordRetry(eq(TargetType.HTTP), anyInt());
        }

        @Test
        @DisplayName("Should record TIMEOUT when the last attempt times out")
        void shouldRecordTimeout() {
            // Given
            job.setMaxRetries(0);
            givenActiveHttpJob();
            givenSavedLogsReturned();
            when(handler.dispatch(job)).thenThrow(new DispatchTimeoutException(5000, null));

            // When
            var result = executionService.execute(delivery(0));

            // Then
            assertThat(result).get().satisfies(executionLog -> {
                assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.TIMEOUT);
                assertThat(executionLog.getErrorType()).isEqualTo("TIMEOUT");
                assertThat(executionLog.getErrorMessage()).isEqualTo("Request timed out after 5000ms");
            });
        }

        @Test
        @DisplayName("Should cap retries at the delivery's attempts")
        void shouldCapRetriesAtDeliveryAttempts() {
            // Given a job allowing 10 retries whose delivery carries 3 attempts
            job.setMaxRetries(10);
            givenActiveHttpJob();
            givenSavedLogsReturned();
            when(handler.dispatch(job)).thenThrow(new DispatchTransportException(job.getTargetUrl(), "reset", null));

            // When
            var result = executionService.execute(delivery(2));

            // Then
            assertThat(result).get().extracting(ExecutionLog::getStatus).isEqualTo(ExecutionStatus.FAILED);
        }

        @Test
        @DisplayName("Should propagate a retryable failure out of consume")
        void shouldPropagateFromConsume() {
            // Given
            givenActiveHttpJob();
            when(handler.dispatch(job)).thenThrow(new DispatchTransportException(job.getTargetUrl(), "reset", null));

            // When / Then
            assertThatThrownBy(() -> executionService.consume(delivery(0))).isInstanceOf(DispatchTransportException.class);
            verify(executionLogRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Per-job serialization")
    class SerializationTests {

        @BeforeEach
        void enableSerialization() {
            properties.getWorker().setSerializePerJob(true);
        }

        @Test
        @DisplayName("Should skip the firing while another firing holds the job lease")
        void shouldSkipWhenLeaseHeld() {
            // Given
            when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
            when(lockProvider.lock(any(LockConfiguration.class))).thenReturn(Optional.empty());

            // When
            var result = executionService.execute(delivery(0));

            // Then
            assertThat(result).isEmpty();
            verify(handlerRegistry, never()).getHandlerOrThrow(any());
            verify(metricsConfig).recordSkipped("overlap");
        }

        @Test
        @DisplayName("Should release the job lease after dispatching")
        void shouldReleaseLease() {
            // Given
            var lock = mock(SimpleLock.class);
            givenActiveHttpJob();
            givenSavedLogsReturned();
            when(lockProvider.lock(any(LockConfiguration.class))).thenReturn(Optional.of(lock));
            when(handler.dispatch(job)).thenReturn(DispatchResult.fromResponse(200, "ok"));

            // When
            executionService.execute(delivery(0));

            // Then
            var configCaptor = ArgumentCaptor.forClass(LockConfiguration.class);
            verify(lockProvider).lock(configCaptor.capture());
            assertThat(configCaptor.getValue().getName()).isEqualTo("cron-job-" + jobId);
            verify(lock).unlock();
        }
    }
}
