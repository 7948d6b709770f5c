package com.fintech.donations.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Stripe credentials and webhook verification settings.
 */
@Data
@ConfigurationProperties(prefix = "stripe")
public class StripeProperties {

    /**
     * Signing secret of the webhook endpoint (whsec_...).
     */
    private String webhookSecret;

    /**
     * Secret API key used for processor lookups. Only needed when the Stripe client is enabled.
     */
    private String apiKey;

    /**
     * Maximum age of a signed payload.
     */
    private long signatureToleranceSeconds = 300;
}
