package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.WebhookEvent;

/**
 * Applies one type of Stripe event to the ledger.
 * <p>
 * Handlers may be invoked more than once for the same event (redelivery after a
 * failure), so every effect must be keyed on something that makes a second
 * application a no-op. Exceptions propagate and cause Stripe to redeliver.
 *
 * @param <T> payload class of {@link #type()}
 */
public interface WebhookEventHandler<T> {

    WebhookEventType type();

    Class<T> payloadType();

    void handle(T payload, WebhookEvent event);
}
