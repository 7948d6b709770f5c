package com.fintech.donations.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Audit record of an inbound Stripe webhook event.
 * <p>
 * The primary key is the Stripe event ID, so a second delivery of the same event
 * always lands on the same row. Rows are never deleted.
 */
@Entity
@Table(name = "webhook_events", indexes = {
        @Index(name = "idx_webhook_events_status", columnList = "status"),
        @Index(name = "idx_webhook_events_status_started", columnList = "status, processing_started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEventRecord {

    @Id
    @Column(name = "event_id", length = 100)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProcessingState status;

    @Column(name = "attempt_count", nullable = false)
    @Builder.Default
    private Integer attemptCount = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "processing_started_at")
    private LocalDateTime processingStartedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isCompleted() {
        return status == ProcessingState.COMPLETED;
    }
}
