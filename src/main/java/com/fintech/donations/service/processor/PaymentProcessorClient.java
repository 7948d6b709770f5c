package com.fintech.donations.service.processor;

import com.fintech.donations.dto.stripe.ChargePayload;
import com.fintech.donations.dto.stripe.CustomerDetails;
import com.fintech.donations.dto.stripe.PaymentIntentPayload;
import com.fintech.donations.dto.stripe.PaymentMethodDetails;
import com.fintech.donations.dto.stripe.SubscriptionPayload;
import com.fintech.donations.exception.ProcessorApiException;

import java.util.Optional;

/**
 * Interface for read-only lookups against the payment processor.
 * <p>
 * Implementations return {@link Optional#empty()} for unknown IDs and throw
 * {@link ProcessorApiException} for transport, authentication or rate-limit failures.
 */
public interface PaymentProcessorClient {

    Optional<PaymentIntentPayload> retrievePaymentIntent(String paymentIntentId) throws ProcessorApiException;

    Optional<ChargePayload> retrieveCharge(String chargeId) throws ProcessorApiException;

    Optional<PaymentMethodDetails> retrievePaymentMethod(String paymentMethodId) throws ProcessorApiException;

    Optional<SubscriptionPayload> retrieveSubscription(String subscriptionId) throws ProcessorApiException;

    Optional<CustomerDetails> retrieveCustomer(String customerId) throws ProcessorApiException;

    /**
     * Get the name of this processor (for logging and exception context).
     */
    String getProcessorName();
}
