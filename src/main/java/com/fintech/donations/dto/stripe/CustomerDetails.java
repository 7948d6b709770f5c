package com.fintech.donations.dto.stripe;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contact details of a Stripe customer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerDetails {

    private String id;

    private String email;

    private String name;
}
