package com.fintech.donations.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A recurring donation, keyed by its Stripe subscription ID.
 */
@Entity
@Table(name = "recurring_donations", indexes = {
        @Index(name = "idx_recurring_status", columnList = "status"),
        @Index(name = "idx_recurring_donor_email", columnList = "donor_email")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecurringDonation {

    @Id
    @Column(name = "subscription_id", length = 100)
    private String subscriptionId;

    @Column(name = "customer_id", length = 100)
    private String customerId;

    @Column(name = "donor_name", length = 200)
    private String donorName;

    @Column(name = "donor_email", length = 320)
    private String donorEmail;

    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DonationFrequency frequency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubscriptionStatus status;

    @Column(name = "next_payment_date")
    private LocalDate nextPaymentDate;

    @Column(name = "last_payment_at")
    private LocalDateTime lastPaymentAt;

    @Column(name = "last_payment_donation_id")
    private Long lastPaymentDonationId;

    @Column(name = "payment_attempt_count", nullable = false)
    @Builder.Default
    private Integer paymentAttemptCount = 0;

    @Column(name = "payment_error_message", length = 500)
    private String paymentErrorMessage;

    @Column(name = "last_payment_error_at")
    private LocalDateTime lastPaymentErrorAt;

    @Column(name = "donation_type_id", length = 100)
    private String donationTypeId;

    @Column(name = "donation_type_label", length = 200)
    private String donationTypeLabel;

    @Column(name = "campaign_id", length = 100)
    private String campaignId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    /**
     * Set once the deletion event has been handled and the donor told. A status update can
     * cancel the row earlier without notifying anyone.
     */
    @Column(name = "cancellation_notified_at")
    private LocalDateTime cancellationNotifiedAt;

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

    /**
     * Moves to {@code target} if the lifecycle allows it.
     *
     * @return true if the status is now {@code target}
     */
    public boolean transitionTo(SubscriptionStatus target) {
        if (status != null && !status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        return true;
    }
}
