package com.fintech.donations.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body returned to Stripe for every accepted delivery.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookAcknowledgement {

    public static final String ALREADY_PROCESSED = "already_processed";

    private boolean received;

    private String skipped;

    private Boolean ignored;

    public static WebhookAcknowledgement processed() {
        return new WebhookAcknowledgement(true, null, null);
    }

    public static WebhookAcknowledgement duplicate() {
        return new WebhookAcknowledgement(true, ALREADY_PROCESSED, null);
    }

    public static WebhookAcknowledgement ignored() {
        return new WebhookAcknowledgement(true, null, Boolean.TRUE);
    }
}
