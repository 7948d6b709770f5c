package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.ChargePayload;
import com.fintech.donations.dto.stripe.PaymentIntentPayload;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.DonationSource;
import com.fintech.donations.service.DonationMetadata;
import com.fintech.donations.service.DonationRecordService;
import com.fintech.donations.service.notification.EmailTemplate;
import com.fintech.donations.service.processor.PaymentDetailsResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Fallback path for one-time payments that did not go through Checkout.
 * <p>
 * Subscription payments also raise this event; they are recognised (invoice on the
 * intent, recurring flag in metadata, or an invoice on the charge) and left to the
 * invoice handler.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentIntentSucceededHandler implements WebhookEventHandler<PaymentIntentPayload> {

    private final DonationRecordService donationRecordService;
    private final PaymentDetailsResolver paymentDetailsResolver;

    @Override
    public WebhookEventType type() {
        return WebhookEventType.PAYMENT_INTENT_SUCCEEDED;
    }

    @Override
    public Class<PaymentIntentPayload> payloadType() {
        return PaymentIntentPayload.class;
    }

    @Override
    public void handle(PaymentIntentPayload paymentIntent, WebhookEvent event) {
        DonationMetadata metadata = DonationMetadata.of(paymentIntent.getMetadata());

        if (paymentIntent.hasInvoice()) {
            log.info("Payment {} belongs to invoice {}, recorded from the invoice",
                    paymentIntent.getId(), paymentIntent.getInvoice());
            return;
        }
        if (metadata.isRecurring()) {
            log.info("Payment {} is a recurring installment, recorded from the invoice", paymentIntent.getId());
            return;
        }

        if (donationRecordService.isAlreadyRecorded(paymentIntent.getId(), null, null)) {
            log.info("Payment {} already recorded, skipping", paymentIntent.getId());
            return;
        }

        Optional<ChargePayload> charge = paymentDetailsResolver.charge(paymentIntent.getLatestCharge());
        if (charge.map(ChargePayload::hasInvoice).orElse(false)) {
            log.info("Payment {} has invoiced charge {}, recorded from the invoice",
                    paymentIntent.getId(), paymentIntent.getLatestCharge());
            return;
        }

        Donation draft = Donation.builder()
                .donorEmail(metadata.donorEmail())
                .donorName(metadata.donorName())
                .donorPhone(metadata.donorPhone())
                .amount(paymentIntent.getAmount() == null ? 0L : paymentIntent.getAmount())
                .currency(paymentIntent.getCurrency())
                .source(DonationSource.PAYMENT_INTENT)
                .recurring(false)
                .paymentIntentId(paymentIntent.getId())
                .customerId(paymentIntent.getCustomer())
                .receiptUrl(charge.map(ChargePayload::getReceiptUrl).orElse(null))
                .donationTypeId(metadata.donationTypeId())
                .donationTypeLabel(metadata.donationTypeLabel())
                .campaignId(metadata.campaignId())
                .donorMessage(metadata.donorMessage())
                .build();

        donationRecordService.recordDonation(draft, paymentIntent.getPaymentMethod(),
                paymentIntent.getLatestCharge(), EmailTemplate.ONE_TIME_RECEIPT);
    }
}
