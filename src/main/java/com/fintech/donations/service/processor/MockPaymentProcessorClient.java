package com.fintech.donations.service.processor;

import com.fintech.donations.dto.stripe.ChargePayload;
import com.fintech.donations.dto.stripe.CustomerDetails;
import com.fintech.donations.dto.stripe.PaymentIntentPayload;
import com.fintech.donations.dto.stripe.PaymentMethodDetails;
import com.fintech.donations.dto.stripe.SubscriptionPayload;
import com.fintech.donations.exception.ProcessorApiException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of the payment processor client.
 * <p>
 * Used for local development and tests. Simulates:
 * - Object lookups by ID
 * - Intermittent failures and full outages (for testing resilience)
 * - Network latency
 */
@Service
@ConditionalOnProperty(name = "processor.stripe.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class MockPaymentProcessorClient implements PaymentProcessorClient {

    private static final String PROCESSOR_NAME = "MockProcessor";

    private final Map<String, PaymentIntentPayload> paymentIntents = new ConcurrentHashMap<>();
    private final Map<String, ChargePayload> charges = new ConcurrentHashMap<>();
    private final Map<String, PaymentMethodDetails> paymentMethods = new ConcurrentHashMap<>();
    private final Map<String, SubscriptionPayload> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, CustomerDetails> customers = new ConcurrentHashMap<>();

    private final Random random = new Random();

    @Value("${processor.mock.failure-rate:0.0}")
    private double failureRate;

    @Value("${processor.mock.latency-ms:0}")
    private int latencyMs;

    private volatile boolean simulateOutage = false;

    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "lookupFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${processor.retry.delay-ms:1000}", multiplier = 2)
    )
    public Optional<PaymentIntentPayload> retrievePaymentIntent(String paymentIntentId) {
        return lookup(paymentIntents, paymentIntentId);
    }

    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "lookupFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${processor.retry.delay-ms:1000}", multiplier = 2)
    )
    public Optional<ChargePayload> retrieveCharge(String chargeId) {
        return lookup(charges, chargeId);
    }

    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "lookupFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${processor.retry.delay-ms:1000}", multiplier = 2)
    )
    public Optional<PaymentMethodDetails> retrievePaymentMethod(String paymentMethodId) {
        return lookup(paymentMethods, paymentMethodId);
    }

    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "lookupFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${processor.retry.delay-ms:1000}", multiplier = 2)
    )
    public Optional<SubscriptionPayload> retrieveSubscription(String subscriptionId) {
        return lookup(subscriptions, subscriptionId);
    }

    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "lookupFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${processor.retry.delay-ms:1000}", multiplier = 2)
    )
    public Optional<CustomerDetails> retrieveCustomer(String customerId) {
        return lookup(customers, customerId);
    }

    /**
     * Fallback when the circuit breaker is open or a lookup keeps failing.
     */
    public <T> Optional<T> lookupFallback(String objectId, Throwable throwable) {
        if (throwable instanceof ProcessorApiException processorError) {
            throw processorError;
        }
        log.warn("Circuit breaker triggered for processor lookup of {}. Error: {}",
                objectId, throwable.getMessage());
        throw new ProcessorApiException(
                "Processor API circuit breaker is open. Service temporarily unavailable.",
                PROCESSOR_NAME,
                objectId,
                true,
                throwable
        );
    }

    private <T> Optional<T> lookup(Map<String, T> store, String objectId) {
        simulateLatency();

        if (simulateOutage) {
            throw new ProcessorApiException(
                    "Processor API is currently unavailable",
                    PROCESSOR_NAME,
                    objectId,
                    true
            );
        }

        if (failureRate > 0 && random.nextDouble() < failureRate) {
            throw new ProcessorApiException(
                    "Simulated network failure while contacting processor",
                    PROCESSOR_NAME,
                    objectId,
                    true
            );
        }

        if (objectId == null) {
            return Optional.empty();
        }
        T found = store.get(objectId);
        if (found == null) {
            log.debug("Object not found in mock processor: {}", objectId);
        }
        return Optional.ofNullable(found);
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(random.nextInt(latencyMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public String getProcessorName() {
        return PROCESSOR_NAME;
    }

    // Methods for testing/simulation control

    public void addPaymentIntent(PaymentIntentPayload paymentIntent) {
        paymentIntents.put(paymentIntent.getId(), paymentIntent);
    }

    public void addCharge(ChargePayload charge) {
        charges.put(charge.getId(), charge);
    }

    public void addPaymentMethod(PaymentMethodDetails paymentMethod) {
        paymentMethods.put(paymentMethod.getId(), paymentMethod);
    }

    public void addSubscription(SubscriptionPayload subscription) {
        subscriptions.put(subscription.getId(), subscription);
    }

    public void addCustomer(CustomerDetails customer) {
        customers.put(customer.getId(), customer);
    }

    /**
     * Simulate a processor outage for testing resilience.
     */
    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Processor outage simulation set to: {}", outage);
    }

    public void clearMockData() {
        paymentIntents.clear();
        charges.clear();
        paymentMethods.clear();
        subscriptions.clear();
        customers.clear();
    }
}
