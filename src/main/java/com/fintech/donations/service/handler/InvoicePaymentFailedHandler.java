package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.InvoicePayload;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.service.subscription.SubscriptionLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class InvoicePaymentFailedHandler implements WebhookEventHandler<InvoicePayload> {

    private final SubscriptionLifecycleService subscriptionLifecycleService;

    @Override
    public WebhookEventType type() {
        return WebhookEventType.INVOICE_PAYMENT_FAILED;
    }

    @Override
    public Class<InvoicePayload> payloadType() {
        return InvoicePayload.class;
    }

    @Override
    public void handle(InvoicePayload invoice, WebhookEvent event) {
        String subscriptionId = invoice.resolveSubscriptionId();
        if (subscriptionId == null) {
            log.info("Failed invoice {} is not for a subscription, skipping", invoice.getId());
            return;
        }
        subscriptionLifecycleService.recordFailedPayment(subscriptionId, invoice);
    }
}
