package com.fintech.donations.service.subscription;

import com.fintech.donations.dto.stripe.CustomerDetails;
import com.fintech.donations.dto.stripe.InvoicePayload;
import com.fintech.donations.dto.stripe.SubscriptionPayload;
import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.DonationFrequency;
import com.fintech.donations.entity.PaymentStatus;
import com.fintech.donations.entity.RecurringDonation;
import com.fintech.donations.entity.SubscriptionStatus;
import com.fintech.donations.repository.DonationRepository;
import com.fintech.donations.repository.RecurringDonationRepository;
import com.fintech.donations.service.DonationMetadata;
import com.fintech.donations.service.DonationRecordService;
import com.fintech.donations.service.DonorClassifier;
import com.fintech.donations.service.notification.EmailTemplate;
import com.fintech.donations.service.notification.NotificationDispatcher;
import com.fintech.donations.service.processor.PaymentDetailsResolver;
import com.fintech.donations.service.settings.OrganizationTimezoneProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lifecycle of recurring donations: ACTIVE <-> PAST_DUE, either -> CANCELLED.
 * <p>
 * Every operation re-reads the row and is a no-op when the change is already
 * applied, so redelivered subscription and invoice events are harmless.
 */
@Service
@Slf4j
public class SubscriptionLifecycleService {

    static final int URGENT_ATTEMPT_THRESHOLD = 3;

    private final RecurringDonationRepository recurringDonationRepository;
    private final DonationRepository donationRepository;
    private final NextPaymentDateCalculator nextPaymentDateCalculator;
    private final PaymentDetailsResolver paymentDetailsResolver;
    private final NotificationDispatcher notificationDispatcher;
    private final OrganizationTimezoneProvider timezoneProvider;
    private final Clock clock;

    public SubscriptionLifecycleService(RecurringDonationRepository recurringDonationRepository,
                                        DonationRepository donationRepository,
                                        NextPaymentDateCalculator nextPaymentDateCalculator,
                                        PaymentDetailsResolver paymentDetailsResolver,
                                        NotificationDispatcher notificationDispatcher,
                                        OrganizationTimezoneProvider timezoneProvider,
                                        Clock clock) {
        this.recurringDonationRepository = recurringDonationRepository;
        this.donationRepository = donationRepository;
        this.nextPaymentDateCalculator = nextPaymentDateCalculator;
        this.paymentDetailsResolver = paymentDetailsResolver;
        this.notificationDispatcher = notificationDispatcher;
        this.timezoneProvider = timezoneProvider;
        this.clock = clock;
    }

    /**
     * Creates the recurring donation for a new subscription and welcomes the donor.
     * An existing row is left untouched.
     */
    public void create(SubscriptionPayload subscription) {
        if (recurringDonationRepository.existsById(subscription.getId())) {
            log.info("Recurring donation {} already exists, skipping create", subscription.getId());
            return;
        }

        DonationMetadata metadata = DonationMetadata.of(subscription.getMetadata());
        String email = metadata.donorEmail();
        String name = metadata.donorName();
        if (email == null) {
            Optional<CustomerDetails> customer = paymentDetailsResolver.customer(subscription.getCustomer());
            email = customer.map(CustomerDetails::getEmail).orElse(null);
            if (name == null) {
                name = customer.map(CustomerDetails::getName).orElse(null);
            }
        }

        DonationFrequency frequency = metadata.frequency();
        LocalDateTime now = LocalDateTime.now(clock);
        RecurringDonation recurring = RecurringDonation.builder()
                .subscriptionId(subscription.getId())
                .customerId(subscription.getCustomer())
                .donorEmail(email)
                .donorName(DonorClassifier.displayName(name))
                .amount(subscription.unitAmount())
                .currency(DonationRecordService.normalizeCurrency(subscription.getCurrency()))
                .frequency(frequency)
                .status(SubscriptionStatus.ACTIVE)
                .nextPaymentDate(nextPaymentDateCalculator.fromToday(frequency))
                .donationTypeId(metadata.donationTypeId())
                .donationTypeLabel(metadata.donationTypeLabel())
                .campaignId(metadata.campaignId())
                .startedAt(now)
                .build();

        RecurringDonation saved;
        try {
            saved = recurringDonationRepository.saveAndFlush(recurring);
        } catch (DataIntegrityViolationException e) {
            log.info("Recurring donation {} created concurrently, skipping", subscription.getId());
            return;
        }
        log.info("Created {} recurring donation {} for {} {}", frequency.getValue(), saved.getSubscriptionId(),
                DonationRecordService.formatAmount(saved.getAmount()), saved.getCurrency());

        if (DonorClassifier.hasDeliverableEmail(saved.getDonorEmail())) {
            Map<String, Object> data = subscriptionData(saved);
            data.put("campaignName", metadata.campaignName());
            safeDispatch(EmailTemplate.RECURRING_WELCOME, saved.getDonorEmail(), data);
        }
    }

    /**
     * Fills in donor details captured by a subscription-mode checkout.
     */
    public void backfillDonorDetails(String subscriptionId, String email, String name) {
        Optional<RecurringDonation> found = recurringDonationRepository.findById(subscriptionId);
        if (found.isEmpty()) {
            log.debug("Recurring donation {} not created yet, nothing to backfill", subscriptionId);
            return;
        }
        RecurringDonation recurring = found.get();
        boolean changed = false;
        if (!DonorClassifier.hasDeliverableEmail(recurring.getDonorEmail()) && email != null) {
            recurring.setDonorEmail(email);
            changed = true;
        }
        if (name != null && !name.isBlank()
                && DonorClassifier.ANONYMOUS_NAME.equals(DonorClassifier.displayName(recurring.getDonorName()))) {
            recurring.setDonorName(name.trim());
            changed = true;
        }
        if (changed) {
            recurringDonationRepository.save(recurring);
            log.info("Backfilled donor details on recurring donation {}", subscriptionId);
        }
    }

    /**
     * Records a paid installment: next date advanced, failures cleared, PAST_DUE -> ACTIVE.
     *
     * @param donation the donation recorded for the invoice, or null if it already existed
     */
    public void recordInstallment(String subscriptionId, Donation donation) {
        Optional<RecurringDonation> found = recurringDonationRepository.findById(subscriptionId);
        if (found.isEmpty()) {
            log.warn("Installment paid for unknown recurring donation {}", subscriptionId);
            return;
        }
        RecurringDonation recurring = found.get();
        if (recurring.getStatus() == SubscriptionStatus.CANCELLED) {
            log.warn("Installment paid on cancelled recurring donation {}", subscriptionId);
        }

        recurring.setNextPaymentDate(nextPaymentDateCalculator.fromToday(recurring.getFrequency()));
        recurring.setLastPaymentAt(LocalDateTime.now(clock));
        if (donation != null) {
            recurring.setLastPaymentDonationId(donation.getId());
        }
        recurring.setPaymentAttemptCount(0);
        recurring.setPaymentErrorMessage(null);
        if (recurring.getStatus() == SubscriptionStatus.PAST_DUE) {
            recurring.transitionTo(SubscriptionStatus.ACTIVE);
            log.info("Recurring donation {} is active again", subscriptionId);
        }
        recurringDonationRepository.save(recurring);
    }

    /**
     * Records a failed installment and tells the donor. Urgent from the third attempt.
     */
    public void recordFailedPayment(String subscriptionId, InvoicePayload invoice) {
        Optional<RecurringDonation> found = recurringDonationRepository.findById(subscriptionId);
        if (found.isEmpty()) {
            log.warn("Payment failed for unknown recurring donation {}", subscriptionId);
            return;
        }
        RecurringDonation recurring = found.get();
        if (recurring.getStatus().isTerminal()) {
            log.info("Ignoring failed payment on cancelled recurring donation {}", subscriptionId);
            return;
        }

        int stored = recurring.getPaymentAttemptCount() == null ? 0 : recurring.getPaymentAttemptCount();
        int reported = invoice.getAttemptCount() == null ? 0 : invoice.getAttemptCount();
        int attempts = Math.max(stored + 1, reported);
        String errorMessage = invoice.getLastFinalizationError() != null
                && invoice.getLastFinalizationError().getMessage() != null
                ? invoice.getLastFinalizationError().getMessage()
                : "Payment failed";

        recurring.transitionTo(SubscriptionStatus.PAST_DUE);
        recurring.setPaymentAttemptCount(attempts);
        recurring.setPaymentErrorMessage(errorMessage);
        recurring.setLastPaymentErrorAt(LocalDateTime.now(clock));
        RecurringDonation saved = recurringDonationRepository.save(recurring);

        boolean urgent = attempts >= URGENT_ATTEMPT_THRESHOLD;
        log.warn("Payment attempt {} failed for recurring donation {}{}", attempts, subscriptionId,
                urgent ? " (urgent)" : "");

        String email = saved.getDonorEmail();
        if (!DonorClassifier.hasDeliverableEmail(email)) {
            email = paymentDetailsResolver.customer(invoice.getCustomer())
                    .map(CustomerDetails::getEmail)
                    .orElse(null);
        }
        if (DonorClassifier.hasDeliverableEmail(email)) {
            Map<String, Object> data = subscriptionData(saved);
            data.put("amount", DonationRecordService.formatAmount(
                    invoice.getAmountDue() != null ? invoice.getAmountDue() : saved.getAmount()));
            data.put("attemptCount", attempts);
            data.put("urgent", urgent);
            data.put("errorMessage", errorMessage);
            if (invoice.getNextPaymentAttempt() != null) {
                data.put("nextRetryDate", Instant.ofEpochSecond(invoice.getNextPaymentAttempt())
                        .atZone(timezoneProvider.getZoneId()).toLocalDate().toString());
            }
            safeDispatch(EmailTemplate.PAYMENT_FAILED, email, data);
        } else {
            log.warn("No email to notify failed payment on recurring donation {}", subscriptionId);
        }
    }

    /**
     * Applies amount, frequency and status changes. The donor is emailed only when the
     * amount or frequency changed.
     */
    public void update(SubscriptionPayload subscription) {
        Optional<RecurringDonation> found = recurringDonationRepository.findById(subscription.getId());
        if (found.isEmpty()) {
            log.warn("Update for unknown recurring donation {}", subscription.getId());
            return;
        }
        RecurringDonation recurring = found.get();
        if (recurring.getStatus().isTerminal()) {
            log.info("Ignoring update to cancelled recurring donation {}", subscription.getId());
            return;
        }

        DonationMetadata metadata = DonationMetadata.of(subscription.getMetadata());
        long oldAmount = recurring.getAmount();
        DonationFrequency oldFrequency = recurring.getFrequency();
        SubscriptionStatus oldStatus = recurring.getStatus();

        long newAmount = subscription.unitAmount() > 0 ? subscription.unitAmount() : oldAmount;
        DonationFrequency newFrequency = metadata.hasFrequency() ? metadata.frequency() : oldFrequency;
        SubscriptionStatus newStatus = SubscriptionStatus.fromStripeStatus(subscription.getStatus());

        boolean amountChanged = newAmount != oldAmount;
        boolean frequencyChanged = newFrequency != oldFrequency;
        boolean statusChanged = newStatus != oldStatus;
        if (!amountChanged && !frequencyChanged && !statusChanged) {
            log.debug("Recurring donation {} unchanged", subscription.getId());
            return;
        }

        recurring.setAmount(newAmount);
        recurring.setFrequency(newFrequency);
        if (statusChanged && recurring.transitionTo(newStatus) && newStatus == SubscriptionStatus.CANCELLED) {
            recurring.setCancelledAt(LocalDateTime.now(clock));
            recurring.setNextPaymentDate(null);
        }
        if (recurring.getStatus() != SubscriptionStatus.CANCELLED) {
            recurring.setNextPaymentDate(nextPaymentDateCalculator.fromToday(newFrequency));
        }
        RecurringDonation saved = recurringDonationRepository.save(recurring);
        log.info("Updated recurring donation {}: amount {} -> {}, frequency {} -> {}, status {} -> {}",
                saved.getSubscriptionId(), oldAmount, newAmount, oldFrequency, newFrequency,
                oldStatus, saved.getStatus());

        if ((amountChanged || frequencyChanged) && DonorClassifier.hasDeliverableEmail(saved.getDonorEmail())) {
            Map<String, Object> data = subscriptionData(saved);
            data.put("oldAmount", DonationRecordService.formatAmount(oldAmount));
            data.put("oldFrequency", oldFrequency.getValue());
            safeDispatch(EmailTemplate.SUBSCRIPTION_UPDATED, saved.getDonorEmail(), data);
        }
    }

    /**
     * Cancels the recurring donation and sends the donor their lifetime total.
     * <p>
     * The row may already be CANCELLED by an earlier status update; the donor is still
     * told, once. A second deletion event does nothing.
     */
    public void cancel(SubscriptionPayload subscription) {
        Optional<RecurringDonation> found = recurringDonationRepository.findById(subscription.getId());
        if (found.isEmpty()) {
            log.warn("Cancellation for unknown recurring donation {}", subscription.getId());
            return;
        }
        RecurringDonation recurring = found.get();
        if (recurring.getCancellationNotifiedAt() != null) {
            log.info("Cancellation of recurring donation {} already handled", subscription.getId());
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (recurring.getStatus() != SubscriptionStatus.CANCELLED) {
            recurring.transitionTo(SubscriptionStatus.CANCELLED);
        }
        if (recurring.getCancelledAt() == null) {
            recurring.setCancelledAt(now);
        }
        recurring.setNextPaymentDate(null);
        recurring.setCancellationNotifiedAt(now);
        RecurringDonation saved = recurringDonationRepository.save(recurring);

        long total = donationRepository.sumAmountBySubscriptionIdAndStatus(
                saved.getSubscriptionId(), PaymentStatus.SUCCEEDED);
        log.info("Cancelled recurring donation {}, lifetime total {} {}", saved.getSubscriptionId(),
                DonationRecordService.formatAmount(total), saved.getCurrency());

        if (DonorClassifier.hasDeliverableEmail(saved.getDonorEmail())) {
            Map<String, Object> data = subscriptionData(saved);
            data.put("totalDonated", DonationRecordService.formatAmount(total));
            safeDispatch(EmailTemplate.SUBSCRIPTION_CANCELLED, saved.getDonorEmail(), data);
        }
    }

    private Map<String, Object> subscriptionData(RecurringDonation recurring) {
        Map<String, Object> data = new HashMap<>();
        data.put("subscriptionId", recurring.getSubscriptionId());
        data.put("donorName", recurring.getDonorName());
        data.put("amount", DonationRecordService.formatAmount(recurring.getAmount()));
        data.put("currency", recurring.getCurrency());
        data.put("frequency", recurring.getFrequency().getValue());
        data.put("donationType", recurring.getDonationTypeLabel());
        data.put("nextPaymentDate", Objects.toString(recurring.getNextPaymentDate(), null));
        return data;
    }

    private boolean safeDispatch(EmailTemplate template, String recipient, Map<String, Object> data) {
        try {
            return notificationDispatcher.dispatch(template, recipient, data);
        } catch (RuntimeException e) {
            log.warn("Failed to send {} email to {}: {}", template.getTemplateId(), recipient, e.getMessage());
            return false;
        }
    }
}
