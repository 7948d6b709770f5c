package com.fintech.donations.dto.stripe;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The parts of a Stripe payment method shown on a receipt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMethodDetails {

    private String id;

    /**
     * "card", "au_becs_debit", ...
     */
    private String type;

    private String cardBrand;

    private String cardLast4;
}
