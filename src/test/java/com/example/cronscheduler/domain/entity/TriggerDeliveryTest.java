package com.example.cronscheduler.domain.entity;

import com.example.cronscheduler.domain.enums.DeliveryStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TriggerDelivery Entity Tests")
class TriggerDeliveryTest {

    private TriggerDelivery delivery(int attemptsMade, int maxAttempts) {
        return TriggerDelivery.builder()
                .queueName("cron-jobs")
                .triggerKey("job-1")
                .attemptsMade(attemptsMade)
                .maxAttempts(maxAttempts)
                .backoffDelayMs(2000L)
                .build();
    }

    @Test
    @DisplayName("New deliveries should start pending with no attempts")
    void newDeliveriesShouldStartPending() {
        var delivery = TriggerDelivery.builder().queueName("cron-jobs").triggerKey("job-1").maxAttempts(3).build();

        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(delivery.getAttemptsMade()).isZero();
        assertThat(delivery.getLockedBy()).isNull();
        assertThat(delivery.getLockedUntil()).isNull();
    }

    @Test
    @DisplayName("Should have attempts left until the last attempt is being made")
    void shouldTrackAttemptsLeft() {
        assertThat(delivery(0, 3).hasAttemptsLeft()).isTrue();
        assertThat(delivery(1, 3).hasAttemptsLeft()).isTrue();
        assertThat(delivery(2, 3).hasAttemptsLeft()).isFalse();
        assertThat(delivery(0, 1).hasAttemptsLeft()).isFalse();
    }

    @Test
    @DisplayName("Backoff should double with each failed attempt")
    void backoffShouldDouble() {
        assertThat(delivery(0, 5).nextBackoffMs()).isEqualTo(2000L);
        assertThat(delivery(1, 5).nextBackoffMs()).isEqualTo(4000L);
        assertThat(delivery(3, 5).nextBackoffMs()).isEqualTo(16000L);
    }
}
