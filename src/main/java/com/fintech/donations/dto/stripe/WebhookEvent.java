package com.fintech.donations.dto.stripe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Authenticated Stripe event envelope.
 * <p>
 * {@code data.object} stays an untyped tree until the dispatcher knows which
 * payload class the event type carries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WebhookEvent {

    private String id;

    private String type;

    /**
     * Epoch seconds.
     */
    private Long created;

    private Boolean livemode;

    private String apiVersion;

    private EventData data;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class EventData {
        private JsonNode object;

        /**
         * Only present on *.updated events.
         */
        private JsonNode previousAttributes;
    }
}
