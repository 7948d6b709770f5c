package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.CheckoutSessionPayload;
import com.fintech.donations.dto.stripe.PaymentIntentPayload;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.DonationSource;
import com.fintech.donations.service.DonationMetadata;
import com.fintech.donations.service.DonationRecordService;
import com.fintech.donations.service.notification.EmailTemplate;
import com.fintech.donations.service.processor.PaymentDetailsResolver;
import com.fintech.donations.service.subscription.SubscriptionLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Primary path for one-time donations made through Stripe Checkout.
 * <p>
 * Subscription-mode sessions create no donation; their installments are recorded
 * from invoices. They only contribute the donor details entered at checkout.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CheckoutSessionCompletedHandler implements WebhookEventHandler<CheckoutSessionPayload> {

    private final DonationRecordService donationRecordService;
    private final SubscriptionLifecycleService subscriptionLifecycleService;
    private final PaymentDetailsResolver paymentDetailsResolver;

    @Override
    public WebhookEventType type() {
        return WebhookEventType.CHECKOUT_SESSION_COMPLETED;
    }

    @Override
    public Class<CheckoutSessionPayload> payloadType() {
        return CheckoutSessionPayload.class;
    }

    @Override
    public void handle(CheckoutSessionPayload session, WebhookEvent event) {
        DonationMetadata metadata = DonationMetadata.of(session.getMetadata());
        CheckoutSessionPayload.CustomerDetails details = session.getCustomerDetails();
        String email = firstNonBlank(details == null ? null : details.getEmail(), metadata.donorEmail());
        String name = firstNonBlank(details == null ? null : details.getName(), metadata.donorName());
        String phone = firstNonBlank(details == null ? null : details.getPhone(), metadata.donorPhone());

        if (CheckoutSessionPayload.MODE_SUBSCRIPTION.equals(session.getMode())) {
            if (session.getSubscription() != null) {
                subscriptionLifecycleService.backfillDonorDetails(session.getSubscription(), email, name);
            }
            log.info("Checkout session {} started subscription {}", session.getId(), session.getSubscription());
            return;
        }
        if (!CheckoutSessionPayload.MODE_PAYMENT.equals(session.getMode())) {
            log.warn("Checkout session {} has unsupported mode {}, ignoring", session.getId(), session.getMode());
            return;
        }

        if (donationRecordService.isAlreadyRecorded(session.getPaymentIntent(), session.getId(), null)) {
            log.info("Checkout session {} already recorded, skipping", session.getId());
            return;
        }

        Optional<PaymentIntentPayload> paymentIntent = paymentDetailsResolver.paymentIntent(session.getPaymentIntent());

        Donation draft = Donation.builder()
                .donorEmail(email)
                .donorName(name)
                .donorPhone(phone)
                .amount(session.getAmountTotal() == null ? 0L : session.getAmountTotal())
                .currency(session.getCurrency())
                .source(DonationSource.CHECKOUT)
                .recurring(false)
                .paymentIntentId(session.getPaymentIntent())
                .checkoutSessionId(session.getId())
                .customerId(session.getCustomer())
                .donationTypeId(metadata.donationTypeId())
                .donationTypeLabel(metadata.donationTypeLabel())
                .campaignId(metadata.campaignId())
                .donorMessage(metadata.donorMessage())
                .build();

        donationRecordService.recordDonation(draft,
                paymentIntent.map(PaymentIntentPayload::getPaymentMethod).orElse(null),
                paymentIntent.map(PaymentIntentPayload::getLatestCharge).orElse(null),
                EmailTemplate.ONE_TIME_RECEIPT);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        return second;
    }
}
