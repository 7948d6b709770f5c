package com.fintech.donations.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.donations.config.StripeProperties;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.exception.WebhookSignatureException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Authenticates Stripe webhook requests.
 * <p>
 * The {@code Stripe-Signature} header carries a timestamp and one or more HMAC-SHA256
 * signatures of {@code "{timestamp}.{raw body}"} keyed with the endpoint secret.
 * The body must be verified exactly as received, before any JSON parsing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSignatureVerifier {

    private final StripeProperties stripeProperties;
    private final ObjectMapper objectMapper;

    /**
     * Verifies the signature and parses the event envelope.
     *
     * @throws WebhookSignatureException if the request is not authentic or not a Stripe event
     */
    public WebhookEvent verifyAndParse(String payload, String signatureHeader) {
        String secret = stripeProperties.getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            log.error("Stripe webhook secret is not configured, rejecting webhook");
            throw new WebhookSignatureException("Webhook secret not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookSignatureException("Missing Stripe-Signature header");
        }
        if (payload == null || payload.isEmpty()) {
            throw new WebhookSignatureException("Empty webhook payload");
        }

        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, secret,
                    stripeProperties.getSignatureToleranceSeconds());
        } catch (SignatureVerificationException e) {
            log.warn("Webhook signature verification failed: {}", e.getMessage());
            throw new WebhookSignatureException("Invalid Stripe signature", e);
        }

        WebhookEvent event;
        try {
            event = objectMapper.readValue(payload, WebhookEvent.class);
        } catch (JsonProcessingException e) {
            throw new WebhookSignatureException("Webhook payload is not a valid event", e);
        }

        if (event.getId() == null || event.getType() == null) {
            throw new WebhookSignatureException("Webhook payload has no event id or type");
        }
        if (event.getData() == null || event.getData().getObject() == null
                || event.getData().getObject().isNull()) {
            throw new WebhookSignatureException("Webhook payload has no data object");
        }
        return event;
    }
}
