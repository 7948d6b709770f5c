package com.fintech.donations.dto.stripe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * The {@code payment_intent} object, either from a webhook or from a processor lookup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentIntentPayload {

    private String id;

    private Long amount;

    private String currency;

    private String status;

    private String customer;

    /**
     * Set when the payment belongs to a subscription invoice.
     */
    private String invoice;

    private String latestCharge;

    private String paymentMethod;

    private LastPaymentError lastPaymentError;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    public boolean hasInvoice() {
        return invoice != null && !invoice.isBlank();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LastPaymentError {
        private String code;
        private String message;
    }
}
