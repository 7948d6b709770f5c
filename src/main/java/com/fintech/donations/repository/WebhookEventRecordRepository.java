package com.fintech.donations.repository;

import com.fintech.donations.entity.ProcessingState;
import com.fintech.donations.entity.WebhookEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for the webhook idempotency ledger.
 * <p>
 * State changes are single conditional UPDATE statements so that concurrent deliveries
 * of the same event never race on a read-then-write.
 */
@Repository
public interface WebhookEventRecordRepository extends JpaRepository<WebhookEventRecord, String> {

    /**
     * Registers another processing attempt for an existing, not yet completed event.
     *
     * @return number of rows updated (0 if the event is unknown or already completed)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEventRecord e SET e.attemptCount = e.attemptCount + 1, " +
            "e.status = com.fintech.donations.entity.ProcessingState.STARTED, " +
            "e.processingStartedAt = :now, e.updatedAt = :now, e.version = e.version + 1 " +
            "WHERE e.eventId = :eventId " +
            "AND e.status <> com.fintech.donations.entity.ProcessingState.COMPLETED")
    int registerRetryAttempt(@Param("eventId") String eventId, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEventRecord e SET " +
            "e.status = com.fintech.donations.entity.ProcessingState.COMPLETED, " +
            "e.completedAt = :now, e.lastError = NULL, e.updatedAt = :now, e.version = e.version + 1 " +
            "WHERE e.eventId = :eventId " +
            "AND e.status <> com.fintech.donations.entity.ProcessingState.COMPLETED")
    int markCompleted(@Param("eventId") String eventId, @Param("now") LocalDateTime now);

    /**
     * Records a failed attempt. Completed events are never moved back to FAILED.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEventRecord e SET " +
            "e.status = com.fintech.donations.entity.ProcessingState.FAILED, " +
            "e.lastError = :error, e.updatedAt = :now, e.version = e.version + 1 " +
            "WHERE e.eventId = :eventId " +
            "AND e.status <> com.fintech.donations.entity.ProcessingState.COMPLETED")
    int markFailed(@Param("eventId") String eventId,
                   @Param("error") String error,
                   @Param("now") LocalDateTime now);

    long countByStatus(ProcessingState status);

    /**
     * Events that keep failing and have not completed yet.
     * These should be looked at by a human.
     */
    @Query("SELECT e FROM WebhookEventRecord e " +
            "WHERE e.status <> com.fintech.donations.entity.ProcessingState.COMPLETED " +
            "AND e.attemptCount >= :minAttempts ORDER BY e.createdAt ASC")
    List<WebhookEventRecord> findNeedingReview(@Param("minAttempts") int minAttempts);

    /**
     * Events whose last attempt started before the threshold and never finished,
     * e.g. because the instance died mid-request.
     */
    @Query("SELECT e FROM WebhookEventRecord e " +
            "WHERE e.status = com.fintech.donations.entity.ProcessingState.STARTED " +
            "AND e.processingStartedAt < :startedBefore ORDER BY e.processingStartedAt ASC")
    List<WebhookEventRecord> findStuck(@Param("startedBefore") LocalDateTime startedBefore);
}
