package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.SubscriptionPayload;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.service.subscription.SubscriptionLifecycleService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SubscriptionUpdatedHandler implements WebhookEventHandler<SubscriptionPayload> {

    private final SubscriptionLifecycleService subscriptionLifecycleService;

    @Override
    public WebhookEventType type() {
        return WebhookEventType.SUBSCRIPTION_UPDATED;
    }

    @Override
    public Class<SubscriptionPayload> payloadType() {
        return SubscriptionPayload.class;
    }

    @Override
    public void handle(SubscriptionPayload subscription, WebhookEvent event) {
        subscriptionLifecycleService.update(subscription);
    }
}
