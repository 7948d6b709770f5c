package com.fintech.donations.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One captured payment: a one-time donation or one installment of a recurring donation.
 * <p>
 * Payment intent, checkout session and invoice IDs are each unique, so the same Stripe
 * payment can never be recorded twice even when it is observed through several
 * overlapping webhook events.
 */
@Entity
@Table(name = "donations", indexes = {
        @Index(name = "idx_donations_payment_intent", columnList = "payment_intent_id", unique = true),
        @Index(name = "idx_donations_checkout_session", columnList = "checkout_session_id", unique = true),
        @Index(name = "idx_donations_invoice", columnList = "invoice_id", unique = true),
        @Index(name = "idx_donations_subscription_status", columnList = "subscription_id, payment_status"),
        @Index(name = "idx_donations_campaign", columnList = "campaign_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Donation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "receipt_number", nullable = false, unique = true, length = 20)
    private String receiptNumber;

    @Column(name = "donor_name", length = 200)
    private String donorName;

    @Column(name = "donor_email", length = 320)
    private String donorEmail;

    @Column(name = "donor_phone", length = 50)
    private String donorPhone;

    @Column(nullable = false)
    private boolean anonymous;

    /**
     * Amount in minor units (cents).
     */
    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DonationSource source;

    @Column(nullable = false)
    private boolean recurring;

    @Enumerated(EnumType.STRING)
    @Column(name = "recurring_frequency", length = 20)
    private DonationFrequency recurringFrequency;

    @Column(name = "payment_intent_id", length = 100)
    private String paymentIntentId;

    @Column(name = "checkout_session_id", length = 100)
    private String checkoutSessionId;

    @Column(name = "invoice_id", length = 100)
    private String invoiceId;

    @Column(name = "subscription_id", length = 100)
    private String subscriptionId;

    @Column(name = "customer_id", length = 100)
    private String customerId;

    @Column(name = "payment_method_type", length = 50)
    private String paymentMethodType;

    @Column(name = "card_brand", length = 30)
    private String cardBrand;

    @Column(name = "card_last4", length = 4)
    private String cardLast4;

    @Column(name = "receipt_url", length = 500)
    private String receiptUrl;

    @Column(name = "donation_type_id", length = 100)
    private String donationTypeId;

    @Column(name = "donation_type_label", length = 200)
    private String donationTypeLabel;

    @Column(name = "campaign_id", length = 100)
    private String campaignId;

    @Column(name = "donor_message", length = 1000)
    private String donorMessage;

    /**
     * Calendar date of the donation in the organisation's timezone.
     */
    @Column(name = "donation_date", nullable = false)
    private LocalDate donationDate;

    @Column(name = "receipt_email_sent", nullable = false)
    private boolean receiptEmailSent;

    @Column(name = "receipt_sent_at")
    private LocalDateTime receiptSentAt;

    @Column(name = "refund_amount")
    private Long refundAmount;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    @Column(name = "dispute_id", length = 100)
    private String disputeId;

    @Column(name = "dispute_reason", length = 100)
    private String disputeReason;

    @Column(name = "dispute_amount")
    private Long disputeAmount;

    @Column(name = "disputed_at")
    private LocalDateTime disputedAt;

    /**
     * Portion of the amount already subtracted from the campaign total by refunds or disputes.
     */
    @Column(name = "campaign_reversed_amount", nullable = false)
    @Builder.Default
    private Long campaignReversedAmount = 0L;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

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
     * Raises the reversed amount to {@code target} (capped at the donation amount)
     * and returns how much more has to be taken off the campaign total.
     * Returns 0 when that much was already reversed, so replays are harmless.
     */
    public long reverseCampaignContributionUpTo(long target) {
        long capped = Math.min(Math.max(target, 0L), amount == null ? 0L : amount);
        long alreadyReversed = campaignReversedAmount == null ? 0L : campaignReversedAmount;
        if (capped <= alreadyReversed) {
            return 0L;
        }
        campaignReversedAmount = capped;
        return capped - alreadyReversed;
    }
}
