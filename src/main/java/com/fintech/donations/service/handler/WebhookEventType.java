package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.ChargePayload;
import com.fintech.donations.dto.stripe.CheckoutSessionPayload;
import com.fintech.donations.dto.stripe.DisputePayload;
import com.fintech.donations.dto.stripe.InvoicePayload;
import com.fintech.donations.dto.stripe.PaymentIntentPayload;
import com.fintech.donations.dto.stripe.SubscriptionPayload;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Stripe event types the ledger acts on, with the class of their {@code data.object}.
 * Any other type is acknowledged and ignored.
 */
public enum WebhookEventType {
    CHECKOUT_SESSION_COMPLETED("checkout.session.completed", CheckoutSessionPayload.class),
    PAYMENT_INTENT_SUCCEEDED("payment_intent.succeeded", PaymentIntentPayload.class),
    PAYMENT_INTENT_FAILED("payment_intent.payment_failed", PaymentIntentPayload.class),
    SUBSCRIPTION_CREATED("customer.subscription.created", SubscriptionPayload.class),
    SUBSCRIPTION_UPDATED("customer.subscription.updated", SubscriptionPayload.class),
    SUBSCRIPTION_DELETED("customer.subscription.deleted", SubscriptionPayload.class),
    INVOICE_PAYMENT_SUCCEEDED("invoice.payment_succeeded", InvoicePayload.class),
    INVOICE_PAYMENT_FAILED("invoice.payment_failed", InvoicePayload.class),
    CHARGE_REFUNDED("charge.refunded", ChargePayload.class),
    CHARGE_DISPUTE_CREATED("charge.dispute.created", DisputePayload.class);

    private static final Map<String, WebhookEventType> BY_STRIPE_TYPE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(WebhookEventType::getStripeType, Function.identity()));

    private final String stripeType;
    private final Class<?> payloadType;

    WebhookEventType(String stripeType, Class<?> payloadType) {
        this.stripeType = stripeType;
        this.payloadType = payloadType;
    }

    public String getStripeType() {
        return stripeType;
    }

    public Class<?> getPayloadType() {
        return payloadType;
    }

    public static Optional<WebhookEventType> fromStripeType(String stripeType) {
        return Optional.ofNullable(stripeType).map(BY_STRIPE_TYPE::get);
    }
}
