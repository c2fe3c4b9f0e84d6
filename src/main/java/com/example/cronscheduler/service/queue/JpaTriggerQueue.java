package com.example.cronscheduler.service.queue;

import com.example.cronscheduler.domain.entity.RepeatableTrigger;
import com.example.cronscheduler.domain.entity.TriggerDelivery;
import com.example.cronscheduler.domain.enums.DeliveryKind;
import com.example.cronscheduler.domain.enums.DeliveryStatus;
import com.example.cronscheduler.domain.repository.RepeatableTriggerRepository;
import com.example.cronscheduler.domain.repository.TriggerDeliveryRepository;
import com.example.cronscheduler.exception.InvalidScheduleException;
import com.example.cronscheduler.service.schedule.CronExpressionEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TriggerQueue} stored in PostgreSQL next to the job tables.
 * <p>
 * Repeat rules live in {@code repeatable_triggers}; due firings become rows
 * in {@code trigger_deliveries}. Claiming and promotion select rows with
 * FOR UPDATE SKIP LOCKED, so any number of instances can share a queue.
 * Writes join the caller's transaction when there is one.
 */
@Slf4j
public class JpaTriggerQueue implements TriggerQueue {

    private static final int LAST_ERROR_LIMIT = 2000;

    private final String name;
    private final RepeatableTriggerRepository triggerRepository;
    private final TriggerDeliveryRepository deliveryRepository;
    private final CronExpressionEvaluator cronEvaluator;
    private final Clock clock;
    private final int promotionBatchSize;

    public JpaTriggerQueue(String name, RepeatableTriggerRepository triggerRepository, TriggerDeliveryRepository deliveryRepository,
                           CronExpressionEvaluator cronEvaluator, Clock clock, int promotionBatchSize) {
        this.name = name;
        this.triggerRepository = triggerRepository;
        this.deliveryRepository = deliveryRepository;
        this.cronEvaluator = cronEvaluator;
        this.clock = clock;
        this.promotionBatchSize = promotionBatchSize;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    @Transactional
    public void addRepeatable(String key, Map<String, Object> payload, String cronExpression, String timezone, TriggerOptions options) {
        var now = clock.instant();
        var nextFireAt = cronEvaluator.nextFireTime(cronExpression, timezone, now)
                .orElseThrow(() -> new InvalidScheduleException(cronExpression, timezone, "Cron expression has no future fire time"));

        var trigger = triggerRepository.findByQueueNameAndTriggerKey(name, key)
                .orElseGet(() -> RepeatableTrigger.builder().queueName(name).triggerKey(key).build());

        trigger.setCronExpression(cronExpression);
        trigger.setTimezone(timezone);
        trigger.setPayload(copy(payload));
        trigger.setMaxAttempts(options.maxAttempts());
        trigger.setBackoffDelayMs(options.backoffDelayMs());
        trigger.setNextFireAt(nextFireAt);
        triggerRepository.save(trigger);

        log.debug("[{}] Repeatable trigger {} registered ({} {}), next fire at {}", name, key, cronExpression, timezone, nextFireAt);
    }

    @Override
    @Transactional
    public boolean removeRepeatable(String key) {
        var removed = triggerRepository.deleteByQueueNameAndTriggerKey(name, key) > 0;
        log.debug("[{}] Repeatable trigger {} {}", name, key, removed ? "removed" : "was not registered");
        return removed;
    }

    @Override
    @Transactional(readOnly = true)
    public List<RepeatableTriggerView> listRepeatable() {
        return triggerRepository.findByQueueNameOrderByTriggerKeyAsc(name).stream()
                .map(t -> new RepeatableTriggerView(t.getTriggerKey(), t.getCronExpression(), t.getTimezone(),
                        t.getNextFireAt(), copy(t.getPayload()), t.getMaxAttempts()))
                .toList();
    }

    @Override
    @Transactional
    public void addOnce(String key, Map<String, Object> payload, TriggerOptions options) {
        var delivery = deliveryRepository.save(TriggerDelivery.builder()
                .queueName(name)
                .triggerKey(key)
                .kind(DeliveryKind.ONCE)
                .payload(copy(payload))
                .maxAttempts(options.maxAttempts())
                .backoffDelayMs(options.backoffDelayMs())
                .availableAt(clock.instant())
                .build());

        log.debug("[{}] One-shot delivery {} enqueued for {}", name, delivery.getId(), key);
    }

    @Override
    @Transactional
    public List<QueuedDelivery> claim(int limit, String workerId, Duration lease) {
        if (limit <= 0) {
            return List.of();
        }

        var now = clock.instant();
        var rows = deliveryRepository.findClaimable(name, now, limit);
        for (var row : rows) {
            row.setStatus(DeliveryStatus.PROCESSING);
            row.setLockedBy(workerId);
            row.setLockedUntil(now.plus(lease));
        }
        deliveryRepository.saveAll(rows);

        return rows.stream().map(this::toView).toList();
    }

    @Override
    @Transactional
    public void acknowledge(QueuedDelivery delivery) {
        deliveryRepository.deleteById(delivery.id());
    }

    @Override
    @Transactional
    public void reject(QueuedDelivery delivery, String error) {
        var row = deliveryRepository.findById(delivery.id()).orElse(null);
        if (row == null) {
            log.warn("[{}] Rejected delivery {} no longer exists", name, delivery.id());
            return;
        }

        var retry = row.hasAttemptsLeft();
        var backoffMs = row.nextBackoffMs();

        row.setAttemptsMade(row.getAttemptsMade() + 1);
        row.setLastError(truncate(error));
        row.setLockedBy(null);
        row.setLockedUntil(null);

        if (retry) {
            row.setStatus(DeliveryStatus.PENDING);
            row.setAvailableAt(clock.instant().plusMillis(backoffMs));
            log.info("[{}] Delivery {} for {} failed attempt {}/{}, redelivering in {}ms",
                    name, row.getId(), row.getTriggerKey(), row.getAttemptsMade(), row.getMaxAttempts(), backoffMs);
        } else {
            row.setStatus(DeliveryStatus.FAILED);
            log.warn("[{}] Delivery {} for {} failed after {} attempts: {}",
                    name, row.getId(), row.getTriggerKey(), row.getAttemptsMade(), error);
        }
        deliveryRepository.save(row);
    }

    @Override
    @Transactional
    public void release(QueuedDelivery delivery, Duration delay) {
        deliveryRepository.findById(delivery.id()).ifPresent(row -> {
            row.setStatus(DeliveryStatus.PENDING);
            row.setLockedBy(null);
            row.setLockedUntil(null);
            row.setAvailableAt(clock.instant().plus(delay));
            deliveryRepository.save(row);
        });
    }

    @Override
    @Transactional
    public int promoteDueRepeatables(Instant now) {
        var due = triggerRepository.findDueForUpdate(name, now, promotionBatchSize);
        var promoted = 0;

        for (var trigger : due) {
            deliveryRepository.save(TriggerDelivery.builder()
                    .queueName(name)
                    .triggerKey(trigger.getTriggerKey())
                    .kind(DeliveryKind.REPEATABLE)
                    .payload(copy(trigger.getPayload()))
                    .maxAttempts(trigger.getMaxAttempts())
                    .backoffDelayMs(trigger.getBackoffDelayMs())
                    .availableAt(now)
                    .build());
            promoted++;

            // Advance from now: firings missed while nothing was promoting collapse into this one
            var next = cronEvaluator.nextFireTime(trigger.getCronExpression(), trigger.getTimezone(), now);
            if (next.isPresent()) {
                trigger.setLastFiredAt(now);
                trigger.setNextFireAt(next.get());
                triggerRepository.save(trigger);
            } else {
                log.warn("[{}] Repeatable trigger {} has no further fire time, removing it", name, trigger.getTriggerKey());
                triggerRepository.delete(trigger);
            }
        }

        if (promoted > 0) {
            log.debug("[{}] Promoted {} due repeatable triggers", name, promoted);
        }
        return promoted;
    }

    @Override
    @Transactional
    public int releaseStaleDeliveries(Instant now) {
        var released = deliveryRepository.releaseExpiredLeases(name, now);
        if (released > 0) {
            log.warn("[{}] Released {} deliveries with expired leases", name, released);
        }
        return released;
    }

    @Override
    @Transactional(readOnly = true)
    public long pendingCount() {
        return deliveryRepository.countByQueueNameAndStatus(name, DeliveryStatus.PENDING);
    }

    private QueuedDelivery toView(TriggerDelivery row) {
        return new QueuedDelivery(row.getId(), row.getQueueName(), row.getTriggerKey(), row.getKind(),
                copy(row.getPayload()), row.getAttemptsMade(), row.getMaxAttempts(), row.getCreatedAt());
    }

    private static Map<String, Object> copy(Map<String, Object> payload) {
        return payload == null ? new HashMap<>() : new HashMap<>(payload);
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= LAST_ERROR_LIMIT) {
            return error;
        }
        return error.substring(0, LAST_ERROR_LIMIT);
    }
}
