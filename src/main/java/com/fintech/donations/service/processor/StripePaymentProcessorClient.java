package com.fintech.donations.service.processor;

import com.fintech.donations.config.StripeProperties;
import com.fintech.donations.dto.stripe.ChargePayload;
import com.fintech.donations.dto.stripe.CustomerDetails;
import com.fintech.donations.dto.stripe.PaymentIntentPayload;
import com.fintech.donations.dto.stripe.PaymentMethodDetails;
import com.fintech.donations.dto.stripe.SubscriptionPayload;
import com.fintech.donations.exception.ProcessorApiException;
import com.stripe.exception.AuthenticationException;
import com.stripe.exception.InvalidRequestException;
import com.stripe.exception.PermissionException;
import com.stripe.exception.StripeException;
import com.stripe.model.Charge;
import com.stripe.model.Customer;
import com.stripe.model.PaymentIntent;
import com.stripe.model.PaymentMethod;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionItem;
import com.stripe.net.RequestOptions;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * {@link PaymentProcessorClient} backed by the Stripe API through stripe-java.
 * <p>
 * Only registered when {@code processor.stripe.enabled=true}. Each lookup is
 * retried on transient failures and guarded by the {@code paymentProcessor}
 * circuit breaker.
 */
@Service
@ConditionalOnProperty(name = "processor.stripe.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class StripePaymentProcessorClient implements PaymentProcessorClient {

    private static final String PROCESSOR_NAME = "Stripe";

    private final StripeProperties stripeProperties;

    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "lookupFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            noRetryFor = NonRetryableLookupException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${processor.retry.delay-ms:1000}", multiplier = 2)
    )
    public Optional<PaymentIntentPayload> retrievePaymentIntent(String paymentIntentId) {
        try {
            PaymentIntent intent = PaymentIntent.retrieve(paymentIntentId, requestOptions());
            PaymentIntentPayload.PaymentIntentPayloadBuilder builder = PaymentIntentPayload.builder()
                    .id(intent.getId())
                    .amount(intent.getAmount())
                    .currency(intent.getCurrency())
                    .status(intent.getStatus())
                    .customer(intent.getCustomer())
                    .invoice(intent.getInvoice())
                    .latestCharge(intent.getLatestCharge())
                    .paymentMethod(intent.getPaymentMethod())
                    .metadata(intent.getMetadata() == null
                            ? new HashMap<>() : new HashMap<>(intent.getMetadata()));
            if (intent.getLastPaymentError() != null) {
                builder.lastPaymentError(PaymentIntentPayload.LastPaymentError.builder()
                        .code(intent.getLastPaymentError().getCode())
                        .message(intent.getLastPaymentError().getMessage())
                        .build());
            }
            return Optional.of(builder.build());
        } catch (StripeException e) {
            return handleStripeException(e, paymentIntentId);
        }
    }

    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "lookupFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            noRetryFor = NonRetryableLookupException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${processor.retry.delay-ms:1000}", multiplier = 2)
    )
    public Optional<ChargePayload> retrieveCharge(String chargeId) {
        try {
            Charge charge = Charge.retrieve(chargeId, requestOptions());
            return Optional.of(ChargePayload.builder()
                    .id(charge.getId())
                    .paymentIntent(charge.getPaymentIntent())
                    .invoice(charge.getInvoice())
                    .amount(charge.getAmount())
                    .amountRefunded(charge.getAmountRefunded())
                    .currency(charge.getCurrency())
                    .receiptUrl(charge.getReceiptUrl())
                    .refunded(charge.getRefunded())
                    .build());
        } catch (StripeException e) {
            return handleStripeException(e, chargeId);
        }
    }

    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "lookupFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            noRetryFor = NonRetryableLookupException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${processor.retry.delay-ms:1000}", multiplier = 2)
    )
    public Optional<PaymentMethodDetails> retrievePaymentMethod(String paymentMethodId) {
        try {
            PaymentMethod method = PaymentMethod.retrieve(paymentMethodId, requestOptions());
            PaymentMethodDetails.PaymentMethodDetailsBuilder builder = PaymentMethodDetails.builder()
                    .id(method.getId())
                    .type(method.getType());
            if (method.getCard() != null) {
                builder.cardBrand(method.getCard().getBrand())
                        .cardLast4(method.getCard().getLast4());
            }
            return Optional.of(builder.build());
        } catch (StripeException e) {
            return handleStripeException(e, paymentMethodId);
        }
    }

    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "lookupFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            noRetryFor = NonRetryableLookupException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${processor.retry.delay-ms:1000}", multiplier = 2)
    )
    public Optional<SubscriptionPayload> retrieveSubscription(String subscriptionId) {
        try {
            Subscription subscription = Subscription.retrieve(subscriptionId, requestOptions());
            List<SubscriptionPayload.Item> items = new ArrayList<>();
            if (subscription.getItems() != null && subscription.getItems().getData() != null) {
                for (SubscriptionItem item : subscription.getItems().getData()) {
                    SubscriptionPayload.Price price = item.getPrice() == null ? null
                            : SubscriptionPayload.Price.builder()
                            .id(item.getPrice().getId())
                            .unitAmount(item.getPrice().getUnitAmount())
                            .currency(item.getPrice().getCurrency())
                            .build();
                    items.add(SubscriptionPayload.Item.builder().id(item.getId()).price(price).build());
                }
            }
            return Optional.of(SubscriptionPayload.builder()
                    .id(subscription.getId())
                    .customer(subscription.getCustomer())
                    .status(subscription.getStatus())
                    .currency(subscription.getCurrency())
                    .items(SubscriptionPayload.Items.builder().data(items).build())
                    .metadata(subscription.getMetadata() == null
                            ? new HashMap<>() : new HashMap<>(subscription.getMetadata()))
                    .build());
        } catch (StripeException e) {
            return handleStripeException(e, subscriptionId);
        }
    }

    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "lookupFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            noRetryFor = NonRetryableLookupException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${processor.retry.delay-ms:1000}", multiplier = 2)
    )
    public Optional<CustomerDetails> retrieveCustomer(String customerId) {
        try {
            Customer customer = Customer.retrieve(customerId, requestOptions());
            if (Boolean.TRUE.equals(customer.getDeleted())) {
                log.debug("Customer {} has been deleted at Stripe", customerId);
                return Optional.empty();
            }
            return Optional.of(CustomerDetails.builder()
                    .id(customer.getId())
                    .email(customer.getEmail())
                    .name(customer.getName())
                    .build());
        } catch (StripeException e) {
            return handleStripeException(e, customerId);
        }
    }

    /**
     * Invoked by the circuit breaker for any failure, including when the circuit is open.
     */
    public <T> Optional<T> lookupFallback(String objectId, Throwable throwable) {
        if (throwable instanceof ProcessorApiException processorError) {
            throw processorError;
        }
        log.warn("Circuit breaker triggered for Stripe lookup of {}. Error: {}",
                objectId, throwable.getMessage());
        throw new ProcessorApiException(
                "Stripe API circuit breaker is open. Service temporarily unavailable.",
                PROCESSOR_NAME,
                objectId,
                true,
                throwable
        );
    }

    @Override
    public String getProcessorName() {
        return PROCESSOR_NAME;
    }

    private RequestOptions requestOptions() {
        return RequestOptions.builder()
                .setApiKey(stripeProperties.getApiKey())
                .build();
    }

    /**
     * Unknown IDs become an empty result; credential problems are not retried;
     * everything else (network, rate limits, 5xx) is retryable.
     */
    private <T> Optional<T> handleStripeException(StripeException e, String objectId) {
        if (e instanceof InvalidRequestException && Integer.valueOf(404).equals(e.getStatusCode())) {
            log.warn("Stripe object not found: {}", objectId);
            return Optional.empty();
        }
        if (e instanceof AuthenticationException || e instanceof PermissionException
                || e instanceof InvalidRequestException) {
            throw new NonRetryableLookupException(e.getMessage(), PROCESSOR_NAME, objectId, e);
        }
        throw new ProcessorApiException(
                "Stripe lookup failed: " + e.getMessage(),
                PROCESSOR_NAME,
                objectId,
                true,
                e
        );
    }

    /**
     * Marks failures that a retry cannot fix.
     */
    static class NonRetryableLookupException extends ProcessorApiException {
        NonRetryableLookupException(String message, String processorName, String objectId, Throwable cause) {
            super(message, processorName, objectId, false, cause);
        }
    }
}
