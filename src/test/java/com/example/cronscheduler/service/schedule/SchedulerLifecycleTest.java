package com.example.cronscheduler.service.schedule;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.exception.TriggerQueueException;
import com.example.cronscheduler.service.queue.TriggerWorker;
import com.example.cronscheduler.service.retention.ExecutionLogRetentionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulerLifecycle Tests")
class SchedulerLifecycleTest {

    @Mock
    private JobScheduleReconciler reconciler;

    @Mock
    private ExecutionLogRetentionService retentionService;

    @Mock
    private TriggerWorker jobWorker;

    @Mock
    private TriggerWorker maintenanceWorker;

    private SchedulerLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        lifecycle = new SchedulerLifecycle(reconciler, retentionService, List.of(jobWorker, maintenanceWorker),
                new CronSchedulerProperties());
    }

    @Test
    @DisplayName("Should reconcile before starting workers")
    void shouldReconcileBeforeStartingWorkers() {
        // When
        lifecycle.start();

        // Then
        var inOrder = inOrder(reconciler, retentionService, jobWorker, maintenanceWorker);
        inOrder.verify(reconciler).reconcileAll();
        inOrder.verify(retentionService).scheduleDailyCleanup();
        inOrder.verify(jobWorker).start();
        inOrder.verify(maintenanceWorker).start();
        assertThat(lifecycle.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should start workers even if the cleanup trigger cannot be scheduled")
    void shouldStartWhenCleanupSchedulingFails() {
        // Given
        doThrow(new IllegalStateException("maintenance queue unavailable")).when(retentionService).scheduleDailyCleanup();

        // When
        lifecycle.start();

        // Then
        verify(jobWorker).start();
        assertThat(lifecycle.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should fail startup when the job triggers cannot be reconciled")
    void shouldFailWhenReconcileFails() {
        // Given
        when(reconciler.reconcileAll()).thenThrow(new TriggerQueueException("cron-jobs", null, "down", null));

        // When / Then
        assertThatThrownBy(() -> lifecycle.start()).isInstanceOf(TriggerQueueException.class);
        verify(jobWorker, never()).start();
        assertThat(lifecycle.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should stop claiming on all workers before draining any")
    void shouldStopClaimingBeforeDraining() {
        // Given
        lifecycle.start();

        // When
        lifecycle.stop();

        // Then
        var inOrder = inOrder(jobWorker, maintenanceWorker);
        inOrder.verify(jobWorker).stopClaiming();
        inOrder.verify(maintenanceWorker).stopClaiming();
        inOrder.verify(jobWorker).stop(any(Duration.class));
        inOrder.verify(maintenanceWorker).stop(any(Duration.class));
        assertThat(lifecycle.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should run before the web server starts and stop after it")
    void shouldRunInEarlyPhase() {
        assertThat(lifecycle.getPhase()).isLessThan(SmartLifecycle.DEFAULT_PHASE - 2048);
    }
}
