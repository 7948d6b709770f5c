package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.PaymentIntentPayload;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.service.DonationRecordService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Failed one-time payments are only logged; nothing is recorded.
 */
@Component
@Slf4j
public class PaymentIntentFailedHandler implements WebhookEventHandler<PaymentIntentPayload> {

    @Override
    public WebhookEventType type() {
        return WebhookEventType.PAYMENT_INTENT_FAILED;
    }

    @Override
    public Class<PaymentIntentPayload> payloadType() {
        return PaymentIntentPayload.class;
    }

    @Override
    public void handle(PaymentIntentPayload paymentIntent, WebhookEvent event) {
        String reason = paymentIntent.getLastPaymentError() == null
                ? "unknown" : paymentIntent.getLastPaymentError().getMessage();
        log.warn("Payment {} of {} {} failed: {}", paymentIntent.getId(),
                DonationRecordService.formatAmount(paymentIntent.getAmount()),
                DonationRecordService.normalizeCurrency(paymentIntent.getCurrency()), reason);
    }
}
