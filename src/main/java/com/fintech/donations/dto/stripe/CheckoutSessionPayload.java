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
 * The {@code checkout.session} object delivered with checkout.session.completed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckoutSessionPayload {

    public static final String MODE_PAYMENT = "payment";
    public static final String MODE_SUBSCRIPTION = "subscription";

    private String id;

    /**
     * "payment", "subscription" or "setup".
     */
    private String mode;

    private Long amountTotal;

    private String currency;

    private String paymentIntent;

    private String subscription;

    private String customer;

    private String paymentStatus;

    private CustomerDetails customerDetails;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CustomerDetails {
        private String email;
        private String name;
        private String phone;
    }
}
