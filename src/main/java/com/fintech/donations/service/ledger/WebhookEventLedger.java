package com.fintech.donations.service.ledger;

import com.fintech.donations.dto.LedgerStats;
import com.fintech.donations.entity.ProcessingState;
import com.fintech.donations.entity.WebhookEventRecord;
import com.fintech.donations.repository.WebhookEventRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Idempotency ledger for inbound webhook events.
 * <p>
 * Every state change is a single conditional statement against the event's row:
 * <ul>
 *   <li>unseen -> STARTED (insert, attempt 1)</li>
 *   <li>STARTED/FAILED -> STARTED (attempt + 1)</li>
 *   <li>STARTED/FAILED -> COMPLETED or FAILED</li>
 * </ul>
 * A COMPLETED row is never changed again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookEventLedger {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final WebhookEventRecordRepository repository;
    private final Clock clock;

    public LedgerCheck checkProcessed(String eventId) {
        return repository.findById(eventId)
                .map(LedgerCheck::of)
                .orElseGet(LedgerCheck::unseen);
    }

    public Optional<WebhookEventRecord> find(String eventId) {
        return repository.findById(eventId);
    }

    /**
     * Records the start of a processing attempt.
     *
     * @return false if the event completed in the meantime and must not be processed again
     */
    public boolean markStarted(String eventId, String eventType) {
        LocalDateTime now = LocalDateTime.now(clock);

        if (repository.registerRetryAttempt(eventId, now) > 0) {
            log.info("Retrying event {} ({})", eventId, eventType);
            return true;
        }

        if (repository.existsById(eventId)) {
            // Completed, or inserted by a concurrent delivery since the update above
            if (repository.registerRetryAttempt(eventId, now) > 0) {
                log.info("Concurrent delivery of event {}, registering as retry", eventId);
                return true;
            }
            log.info("Event {} completed concurrently, not processing again", eventId);
            return false;
        }

        try {
            repository.saveAndFlush(WebhookEventRecord.builder()
                    .eventId(eventId)
                    .eventType(eventType)
                    .status(ProcessingState.STARTED)
                    .attemptCount(1)
                    .processingStartedAt(now)
                    .build());
            log.debug("Recorded first attempt of event {} ({})", eventId, eventType);
            return true;
        } catch (DataIntegrityViolationException e) {
            // Another delivery inserted the row first
            log.info("Concurrent first delivery of event {}, registering as retry", eventId);
            return repository.registerRetryAttempt(eventId, now) > 0;
        }
    }

    /**
     * Marks an event as completed. Never throws; a failure here only means
     * a redelivery will be re-applied idempotently by the handlers.
     */
    public void markCompleted(String eventId) {
        try {
            int updated = repository.markCompleted(eventId, LocalDateTime.now(clock));
            if (updated == 0) {
                log.debug("Event {} was already completed", eventId);
            }
        } catch (DataAccessException e) {
            log.error("Failed to mark event {} as completed", eventId, e);
        }
    }

    /**
     * Records a failed attempt unless the event is already completed. Never throws.
     */
    public void markFailed(String eventId, String errorMessage) {
        try {
            repository.markFailed(eventId, truncate(errorMessage), LocalDateTime.now(clock));
        } catch (DataAccessException e) {
            log.error("Failed to mark event {} as failed", eventId, e);
        }
    }

    public List<WebhookEventRecord> findNeedingReview(int minAttempts) {
        return repository.findNeedingReview(minAttempts);
    }

    public List<WebhookEventRecord> findStuck(Duration olderThan) {
        return repository.findStuck(LocalDateTime.now(clock).minus(olderThan));
    }

    public LedgerStats getStats() {
        return LedgerStats.builder()
                .startedEvents(repository.countByStatus(ProcessingState.STARTED))
                .completedEvents(repository.countByStatus(ProcessingState.COMPLETED))
                .failedEvents(repository.countByStatus(ProcessingState.FAILED))
                .build();
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
