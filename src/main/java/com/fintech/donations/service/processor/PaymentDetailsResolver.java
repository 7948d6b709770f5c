package com.fintech.donations.service.processor;

import com.fintech.donations.dto.stripe.ChargePayload;
import com.fintech.donations.dto.stripe.CustomerDetails;
import com.fintech.donations.dto.stripe.PaymentIntentPayload;
import com.fintech.donations.dto.stripe.PaymentMethodDetails;
import com.fintech.donations.dto.stripe.SubscriptionPayload;
import com.fintech.donations.exception.ProcessorApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Best-effort processor lookups used to enrich donations and emails.
 * <p>
 * A failed lookup is logged and treated as "not available"; it never fails the
 * webhook. Callers that must not proceed without the data use
 * {@link PaymentProcessorClient} directly.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentDetailsResolver {

    private final PaymentProcessorClient processorClient;

    public Optional<PaymentMethodDetails> paymentMethod(String paymentMethodId) {
        return tolerant("payment method", paymentMethodId,
                () -> processorClient.retrievePaymentMethod(paymentMethodId));
    }

    public Optional<ChargePayload> charge(String chargeId) {
        return tolerant("charge", chargeId, () -> processorClient.retrieveCharge(chargeId));
    }

    public Optional<String> receiptUrl(String chargeId) {
        return charge(chargeId).map(ChargePayload::getReceiptUrl);
    }

    public Optional<PaymentIntentPayload> paymentIntent(String paymentIntentId) {
        return tolerant("payment intent", paymentIntentId,
                () -> processorClient.retrievePaymentIntent(paymentIntentId));
    }

    public Optional<SubscriptionPayload> subscription(String subscriptionId) {
        return tolerant("subscription", subscriptionId,
                () -> processorClient.retrieveSubscription(subscriptionId));
    }

    public Optional<CustomerDetails> customer(String customerId) {
        return tolerant("customer", customerId, () -> processorClient.retrieveCustomer(customerId));
    }

    private <T> Optional<T> tolerant(String what, String objectId, Supplier<Optional<T>> lookup) {
        if (objectId == null || objectId.isBlank()) {
            return Optional.empty();
        }
        try {
            return lookup.get();
        } catch (ProcessorApiException e) {
            log.warn("Could not retrieve {} {} from {}: {}",
                    what, objectId, processorClient.getProcessorName(), e.getMessage());
            return Optional.empty();
        }
    }
}
