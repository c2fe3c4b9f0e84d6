package com.example.cronscheduler.service.queue;

import com.example.cronscheduler.domain.enums.DeliveryKind;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TriggerWorker Tests")
class TriggerWorkerTest {

    private static final Duration LEASE = Duration.ofMinutes(10);

    @Mock
    private TriggerQueue queue;

    private TriggerWorker worker;

    @BeforeEach
    void setUp() {
        lenient().when(queue.getName()).thenReturn("cron-jobs");
    }

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop(Duration.ofSeconds(1));
        }
    }

    private static QueuedDelivery delivery() {
        return new QueuedDelivery(UUID.randomUUID(), "cron-jobs", "job-1", DeliveryKind.REPEATABLE, Map.of(), 0, 3, Instant.now());
    }

    @Test
    @DisplayName("Should reject a concurrency below one")
    void shouldRejectInvalidConcurrency() {
        assertThatThrownBy(() -> new TriggerWorker("w", queue, d -> { }, 0, null, "host-1", LEASE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should not claim before it is started")
    void shouldNotClaimBeforeStart() {
        // Given
        worker = new TriggerWorker("w", queue, d -> { }, 2, null, "host-1", LEASE);

        // When
        var claimed = worker.poll();

        // Then
        assertThat(claimed).isZero();
        verify(queue, never()).claim(anyInt(), anyString(), any());
    }

    @Nested
    @DisplayName("Processing Tests")
    class ProcessingTests {

        @Test
        @DisplayName("Should acknowledge a delivery the consumer accepts")
        void shouldAcknowledgeOnSuccess() {
            // Given
            var delivery = delivery();
            worker = new TriggerWorker("w", queue, d -> { }, 2, null, "host-1", LEASE);
            worker.start();
            when(queue.claim(2, "host-1", LEASE)).thenReturn(List.of(delivery));

            // When
            var claimed = worker.poll();

            // Then
            assertThat(claimed).isEqualTo(1);
            verify(queue, timeout(2000)).acknowledge(delivery);
            verify(queue, never()).reject(any(), anyString());
        }

        @Test
        @DisplayName("Should reject a delivery the consumer fails with the failure message")
        void shouldRejectOnFailure() {
            // Given
            var delivery = delivery();
            worker = new TriggerWorker("w", queue, d -> {
                throw new IllegalStateException("target unreachable");
            }, 1, null, "host-1", LEASE);
            worker.start();
            when(queue.claim(1, "host-1", LEASE)).thenReturn(List.of(delivery));

            // When
            worker.poll();

            // Then
            verify(queue, timeout(2000)).reject(delivery, "target unreachable");
            verify(queue, never()).acknowledge(any());
        }

        @Test
        @DisplayName("Should claim only as many deliveries as there are free slots")
        void shouldClaimOnlyFreeSlots() throws Exception {
            // Given
            var release = new CountDownLatch(1);
            var started = new CountDownLatch(1);
            worker = new TriggerWorker("w", queue, d -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
            }, 2, null, "host-1", LEASE);
            worker.start();
            when(queue.claim(2, "host-1", LEASE)).thenReturn(List.of(delivery()));
            when(queue.claim(1, "host-1", LEASE)).thenReturn(List.of());

            // When
            worker.poll();
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
            worker.poll();

            // Then
            assertThat(worker.inFlight()).isEqualTo(1);
            verify(queue).claim(1, "host-1", LEASE);
            release.countDown();
        }
    }

    @Nested
    @DisplayName("Rate limiting Tests")
    class RateLimitTests {

        @Test
        @DisplayName("Should postpone deliveries beyond the rate limit without counting an attempt")
        void shouldPostponeRateLimitedDeliveries() {
            // Given
            var limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                    .limitForPeriod(1)
                    .limitRefreshPeriod(Duration.ofMinutes(10))
                    .timeoutDuration(Duration.ZERO)
                    .build());
            var first = delivery();
            var second = delivery();
            worker = new TriggerWorker("w", queue, d -> { }, 2, limiter, "host-1", LEASE);
            worker.start();
            when(queue.claim(2, "host-1", LEASE)).thenReturn(List.of(first, second));

            // When
            worker.poll();

            // Then
            verify(queue, timeout(2000)).acknowledge(any());
            verify(queue, timeout(2000)).release(any(), eq(Duration.ofSeconds(1)));
            verify(queue, never()).reject(any(), anyString());
        }
    }

    @Nested
    @DisplayName("Shutdown Tests")
    class ShutdownTests {

        @Test
        @DisplayName("Should wait for in-flight deliveries within the grace period")
        void shouldDrainInFlightDeliveries() {
            // Given
            var delivery = delivery();
            worker = new TriggerWorker("w", queue, d -> Thread.sleep(100), 1, null, "host-1", LEASE);
            worker.start();
            when(queue.claim(1, "host-1", LEASE)).thenReturn(List.of(delivery));
            worker.poll();

            // When
            var drained = worker.stop(Duration.ofSeconds(5));

            // Then
            assertThat(drained).isTrue();
            assertThat(worker.isRunning()).isFalse();
            verify(queue).acknowledge(delivery);
        }

        @Test
        @DisplayName("Should force shutdown when deliveries outlive the grace period")
        void shouldForceShutdownAfterGracePeriod() throws Exception {
            // Given
            var started = new CountDownLatch(1);
            worker = new TriggerWorker("w", queue, d -> {
                started.countDown();
                Thread.sleep(10_000);
            }, 1, null, "host-1", LEASE);
            worker.start();
            when(queue.claim(1, "host-1", LEASE)).thenReturn(List.of(delivery()));
            worker.poll();
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

            // When
            var drained = worker.stop(Duration.ofMillis(100));

            // Then
            assertThat(drained).isFalse();
        }

        @Test
        @DisplayName("Should stop claiming after stopClaiming")
        void shouldStopClaiming() {
            // Given
            worker = new TriggerWorker("w", queue, d -> { }, 1, null, "host-1", LEASE);
            worker.start();

            // When
            worker.stopClaiming();

            // Then
            assertThat(worker.poll()).isZero();
            verify(queue, never()).claim(anyInt(), anyString(), any());
        }
    }
}
