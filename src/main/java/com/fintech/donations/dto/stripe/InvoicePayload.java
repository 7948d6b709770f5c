package com.fintech.donations.dto.stripe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code invoice} object from invoice.payment_succeeded / invoice.payment_failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InvoicePayload {

    public static final String BILLING_REASON_SUBSCRIPTION_CREATE = "subscription_create";

    private String id;

    private String subscription;

    private Parent parent;

    private String customer;

    private String paymentIntent;

    private String charge;

    private Long amountPaid;

    private Long amountDue;

    private String currency;

    /**
     * subscription_create, subscription_cycle, subscription_update, manual...
     */
    private String billingReason;

    private Integer attemptCount;

    /**
     * Epoch seconds of the next automatic retry, if any.
     */
    private Long nextPaymentAttempt;

    private FinalizationError lastFinalizationError;

    /**
     * Subscription ID from the top-level field, or from
     * {@code parent.subscription_details.subscription} on newer API versions.
     */
    public String resolveSubscriptionId() {
        if (subscription != null && !subscription.isBlank()) {
            return subscription;
        }
        if (parent != null && parent.getSubscriptionDetails() != null) {
            String nested = parent.getSubscriptionDetails().getSubscription();
            if (nested != null && !nested.isBlank()) {
                return nested;
            }
        }
        return null;
    }

    public boolean isFirstInvoice() {
        return BILLING_REASON_SUBSCRIPTION_CREATE.equals(billingReason);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Parent {
        private SubscriptionDetails subscriptionDetails;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SubscriptionDetails {
        private String subscription;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FinalizationError {
        private String code;
        private String message;
    }
}
