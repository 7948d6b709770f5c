package com.fintech.donations.dto.stripe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code charge} object from charge.refunded and from charge lookups.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChargePayload {

    private String id;

    private String paymentIntent;

    private String invoice;

    private Long amount;

    /**
     * Cumulative refunded amount across all refunds of this charge.
     */
    private Long amountRefunded;

    private String currency;

    private String receiptUrl;

    private Boolean refunded;

    public boolean hasInvoice() {
        return invoice != null && !invoice.isBlank();
    }
}
