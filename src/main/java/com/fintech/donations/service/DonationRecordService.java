package com.fintech.donations.service;

import com.fintech.donations.dto.stripe.ChargePayload;
import com.fintech.donations.dto.stripe.DisputePayload;
import com.fintech.donations.dto.stripe.PaymentMethodDetails;
import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.PaymentStatus;
import com.fintech.donations.exception.DonationNotYetRecordedException;
import com.fintech.donations.repository.DonationRepository;
import com.fintech.donations.service.notification.EmailTemplate;
import com.fintech.donations.service.notification.NotificationDispatcher;
import com.fintech.donations.service.processor.PaymentDetailsResolver;
import com.fintech.donations.service.settings.OrganizationTimezoneProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Creates and updates donation records.
 * <p>
 * Key Design Decisions:
 * 1. Lookup before insert: a payment already recorded through another event is skipped
 * 2. Unique indexes on payment intent, session and invoice IDs catch concurrent inserts
 * 3. Campaign totals move only by the part of a donation not yet counted or reversed
 * 4. Emails are best effort; their outcome is stored, never thrown
 */
@Service
@Slf4j
public class DonationRecordService {

    private final DonationRepository donationRepository;
    private final ReceiptNumberGenerator receiptNumberGenerator;
    private final CampaignAggregator campaignAggregator;
    private final PaymentDetailsResolver paymentDetailsResolver;
    private final NotificationDispatcher notificationDispatcher;
    private final OrganizationTimezoneProvider timezoneProvider;
    private final RetryTemplate disputeLookupRetryTemplate;
    private final Clock clock;

    @Value("${donations.notifications.admin-email:admin@example.org}")
    private String adminEmail;

    public DonationRecordService(DonationRepository donationRepository,
                                 ReceiptNumberGenerator receiptNumberGenerator,
                                 CampaignAggregator campaignAggregator,
                                 PaymentDetailsResolver paymentDetailsResolver,
                                 NotificationDispatcher notificationDispatcher,
                                 OrganizationTimezoneProvider timezoneProvider,
                                 @Qualifier("disputeLookupRetryTemplate") RetryTemplate disputeLookupRetryTemplate,
                                 Clock clock) {
        this.donationRepository = donationRepository;
        this.receiptNumberGenerator = receiptNumberGenerator;
        this.campaignAggregator = campaignAggregator;
        this.paymentDetailsResolver = paymentDetailsResolver;
        this.notificationDispatcher = notificationDispatcher;
        this.timezoneProvider = timezoneProvider;
        this.disputeLookupRetryTemplate = disputeLookupRetryTemplate;
        this.clock = clock;
    }

    /**
     * True if a donation already exists for any of the given Stripe IDs (nulls are ignored).
     */
    public boolean isAlreadyRecorded(String paymentIntentId, String checkoutSessionId, String invoiceId) {
        if (paymentIntentId != null && donationRepository.existsByPaymentIntentId(paymentIntentId)) {
            return true;
        }
        if (checkoutSessionId != null && donationRepository.existsByCheckoutSessionId(checkoutSessionId)) {
            return true;
        }
        return invoiceId != null && donationRepository.existsByInvoiceId(invoiceId);
    }

    /**
     * Records a captured payment unless it is already in the ledger.
     *
     * @param draft           donor, amount, source and Stripe IDs; receipt number,
     *                        date and status are filled in here
     * @param paymentMethodId used to look up card brand and last4, may be null
     * @param chargeId        used to look up the Stripe receipt URL, may be null
     * @param receiptTemplate receipt email to send, or null to send none
     * @return the new donation, or empty if it was already recorded
     */
    public Optional<Donation> recordDonation(Donation draft, String paymentMethodId, String chargeId,
                                             EmailTemplate receiptTemplate) {
        if (isAlreadyRecorded(draft.getPaymentIntentId(), draft.getCheckoutSessionId(), draft.getInvoiceId())) {
            log.info("Donation already recorded for payment {} / session {} / invoice {}, skipping",
                    draft.getPaymentIntentId(), draft.getCheckoutSessionId(), draft.getInvoiceId());
            return Optional.empty();
        }

        applyPaymentDetails(draft, paymentMethodId, chargeId);

        LocalDateTime now = LocalDateTime.now(clock);
        draft.setReceiptNumber(receiptNumberGenerator.next());
        draft.setDonationDate(timezoneProvider.today());
        draft.setAnonymous(DonorClassifier.isAnonymous(draft.getDonorEmail(), draft.getDonorName()));
        draft.setDonorName(DonorClassifier.displayName(draft.getDonorName()));
        draft.setCurrency(normalizeCurrency(draft.getCurrency()));
        draft.setPaymentStatus(PaymentStatus.SUCCEEDED);
        draft.setCompletedAt(now);

        Donation saved;
        try {
            saved = donationRepository.saveAndFlush(draft);
        } catch (DataIntegrityViolationException e) {
            log.info("Donation for payment {} / session {} / invoice {} recorded concurrently, skipping",
                    draft.getPaymentIntentId(), draft.getCheckoutSessionId(), draft.getInvoiceId());
            return Optional.empty();
        }

        log.info("Recorded donation {} ({} {}) from {}", saved.getReceiptNumber(),
                formatAmount(saved.getAmount()), saved.getCurrency(), saved.getSource());

        campaignAggregator.adjustTotal(saved.getCampaignId(), saved.getAmount());

        if (receiptTemplate != null) {
            sendReceipt(saved, receiptTemplate);
        }
        return Optional.of(saved);
    }

    /**
     * Applies a (possibly partial, possibly repeated) refund of a charge.
     * Stripe reports the cumulative refunded amount, so replays change nothing.
     */
    public void recordRefund(ChargePayload charge) {
        String paymentIntentId = charge.getPaymentIntent();
        if (paymentIntentId == null) {
            log.warn("Refunded charge {} has no payment intent, ignoring", charge.getId());
            return;
        }
        Optional<Donation> found = donationRepository.findFirstByPaymentIntentId(paymentIntentId);
        if (found.isEmpty()) {
            log.warn("No donation found for refunded payment {}", paymentIntentId);
            return;
        }

        Donation donation = found.get();
        long refunded = charge.getAmountRefunded() != null ? charge.getAmountRefunded()
                : charge.getAmount() != null ? charge.getAmount() : donation.getAmount();
        boolean alreadyApplied = donation.getRefundAmount() != null && donation.getRefundAmount() >= refunded;

        donation.setPaymentStatus(PaymentStatus.REFUNDED);
        if (!alreadyApplied) {
            donation.setRefundAmount(refunded);
            donation.setRefundedAt(LocalDateTime.now(clock));
        }
        long reversal = donation.reverseCampaignContributionUpTo(refunded);
        Donation saved = donationRepository.save(donation);

        if (reversal > 0) {
            campaignAggregator.adjustTotal(saved.getCampaignId(), -reversal);
        }

        if (alreadyApplied) {
            log.info("Refund of {} for donation {} already applied", refunded, saved.getReceiptNumber());
            return;
        }
        log.info("Donation {} refunded {} {}", saved.getReceiptNumber(), formatAmount(refunded), saved.getCurrency());

        if (DonorClassifier.hasDeliverableEmail(saved.getDonorEmail())) {
            Map<String, Object> data = receiptData(saved);
            data.put("refundAmount", formatAmount(refunded));
            data.put("refundCurrency", normalizeCurrency(charge.getCurrency() != null
                    ? charge.getCurrency() : saved.getCurrency()));
            safeDispatch(EmailTemplate.REFUND_CONFIRMATION, saved.getDonorEmail(), data);
        }
    }

    /**
     * Marks the disputed donation and alerts the administrators.
     * <p>
     * The dispute can be delivered before the donation it refers to has been recorded,
     * so the lookup is retried a bounded number of times. If the donation never shows
     * up the dispute is logged as unresolved and the event still succeeds.
     */
    public void recordDispute(DisputePayload dispute) {
        String paymentIntentId = dispute.getPaymentIntent();
        if (paymentIntentId == null) {
            paymentIntentId = paymentDetailsResolver.charge(dispute.getCharge())
                    .map(ChargePayload::getPaymentIntent)
                    .orElse(null);
        }
        if (paymentIntentId == null) {
            log.warn("Unresolved dispute {}: no payment intent for charge {}", dispute.getId(), dispute.getCharge());
            return;
        }

        Optional<Donation> found = findDonationWithRetry(paymentIntentId);
        if (found.isEmpty()) {
            log.warn("Unresolved dispute {}: no donation recorded for payment {}", dispute.getId(), paymentIntentId);
            return;
        }

        Donation donation = found.get();
        boolean alreadyApplied = dispute.getId() != null && dispute.getId().equals(donation.getDisputeId());

        donation.setPaymentStatus(PaymentStatus.DISPUTED);
        donation.setDisputeId(dispute.getId());
        donation.setDisputeReason(dispute.getReason());
        donation.setDisputeAmount(dispute.getAmount());
        if (!alreadyApplied) {
            donation.setDisputedAt(LocalDateTime.now(clock));
        }
        long disputed = dispute.getAmount() != null ? dispute.getAmount() : donation.getAmount();
        long reversal = donation.reverseCampaignContributionUpTo(disputed);
        Donation saved = donationRepository.save(donation);

        if (reversal > 0) {
            campaignAggregator.adjustTotal(saved.getCampaignId(), -reversal);
        }

        if (saved.isRecurring()) {
            log.warn("Dispute {} is on recurring donation {} (subscription {}), needs manual review",
                    dispute.getId(), saved.getReceiptNumber(), saved.getSubscriptionId());
        }

        if (alreadyApplied) {
            log.info("Dispute {} already applied to donation {}", dispute.getId(), saved.getReceiptNumber());
            return;
        }
        log.warn("Donation {} disputed: {} {} ({})", saved.getReceiptNumber(),
                formatAmount(disputed), saved.getCurrency(), dispute.getReason());

        Map<String, Object> data = new HashMap<>();
        data.put("disputeId", dispute.getId());
        data.put("receiptNumber", saved.getReceiptNumber());
        data.put("donorName", saved.getDonorName());
        data.put("amount", formatAmount(disputed));
        data.put("currency", normalizeCurrency(dispute.getCurrency() != null ? dispute.getCurrency() : saved.getCurrency()));
        data.put("reason", dispute.getReason());
        data.put("recurring", saved.isRecurring());
        if (dispute.getEvidenceDetails() != null && dispute.getEvidenceDetails().getDueBy() != null) {
            data.put("evidenceDueBy", Instant.ofEpochSecond(dispute.getEvidenceDetails().getDueBy())
                    .atZone(timezoneProvider.getZoneId()).toLocalDate().toString());
        }
        safeDispatch(EmailTemplate.DISPUTE_ALERT, adminEmail, data);
    }

    /**
     * Sends a receipt for a stored donation and records whether it went out.
     */
    public void sendReceipt(Donation donation, EmailTemplate template) {
        if (!DonorClassifier.hasDeliverableEmail(donation.getDonorEmail())) {
            log.debug("Donation {} has no deliverable email, no receipt sent", donation.getReceiptNumber());
            return;
        }
        boolean sent = safeDispatch(template, donation.getDonorEmail(), receiptData(donation));
        donation.setReceiptEmailSent(sent);
        if (sent) {
            donation.setReceiptSentAt(LocalDateTime.now(clock));
        }
        donationRepository.save(donation);
    }

    /**
     * Only a donation that is still missing after the last attempt yields empty.
     * Store failures are not retried here and propagate to fail the event.
     */
    private Optional<Donation> findDonationWithRetry(String paymentIntentId) {
        try {
            return Optional.of(disputeLookupRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("Looking up donation for payment {} again (attempt {})",
                            paymentIntentId, context.getRetryCount() + 1);
                }
                return donationRepository.findFirstByPaymentIntentId(paymentIntentId)
                        .orElseThrow(() -> new DonationNotYetRecordedException(paymentIntentId));
            }));
        } catch (DonationNotYetRecordedException e) {
            return Optional.empty();
        }
    }

    private void applyPaymentDetails(Donation draft, String paymentMethodId, String chargeId) {
        Optional<PaymentMethodDetails> method = paymentDetailsResolver.paymentMethod(paymentMethodId);
        method.ifPresent(details -> {
            draft.setPaymentMethodType(details.getType());
            draft.setCardBrand(details.getCardBrand());
            draft.setCardLast4(details.getCardLast4());
        });
        if (draft.getReceiptUrl() == null) {
            paymentDetailsResolver.receiptUrl(chargeId).ifPresent(draft::setReceiptUrl);
        }
    }

    private boolean safeDispatch(EmailTemplate template, String recipient, Map<String, Object> data) {
        try {
            return notificationDispatcher.dispatch(template, recipient, data);
        } catch (RuntimeException e) {
            log.warn("Failed to send {} email to {}: {}", template.getTemplateId(), recipient, e.getMessage());
            return false;
        }
    }

    private Map<String, Object> receiptData(Donation donation) {
        Map<String, Object> data = new HashMap<>();
        data.put("receiptNumber", donation.getReceiptNumber());
        data.put("donorName", donation.getDonorName());
        data.put("amount", formatAmount(donation.getAmount()));
        data.put("currency", donation.getCurrency());
        data.put("donationDate", String.valueOf(donation.getDonationDate()));
        data.put("donationType", donation.getDonationTypeLabel());
        data.put("recurring", donation.isRecurring());
        if (donation.getRecurringFrequency() != null) {
            data.put("frequency", donation.getRecurringFrequency().getValue());
        }
        if (donation.getCardBrand() != null) {
            data.put("cardBrand", donation.getCardBrand());
            data.put("cardLast4", donation.getCardLast4());
        }
        if (donation.getReceiptUrl() != null) {
            data.put("receiptUrl", donation.getReceiptUrl());
        }
        return data;
    }

    /**
     * Minor units to a decimal string, e.g. 2550 to "25.50".
     */
    public static String formatAmount(Long minorUnits) {
        return BigDecimal.valueOf(minorUnits == null ? 0L : minorUnits, 2).toPlainString();
    }

    public static String normalizeCurrency(String currency) {
        return (currency == null || currency.isBlank() ? "aud" : currency).toUpperCase(Locale.ROOT);
    }
}
