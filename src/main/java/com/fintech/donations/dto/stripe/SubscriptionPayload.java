package com.fintech.donations.dto.stripe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code subscription} object from customer.subscription.* events and lookups.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubscriptionPayload {

    private String id;

    private String customer;

    /**
     * Stripe status: active, past_due, unpaid, canceled, incomplete, trialing...
     */
    private String status;

    private String currency;

    private Items items;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    /**
     * Unit amount of the first subscription item, 0 when unknown.
     */
    public long unitAmount() {
        if (items == null || items.getData() == null || items.getData().isEmpty()) {
            return 0L;
        }
        Item first = items.getData().get(0);
        if (first.getPrice() == null || first.getPrice().getUnitAmount() == null) {
            return 0L;
        }
        return first.getPrice().getUnitAmount();
    }

    public static SubscriptionPayload.Items singleItem(long unitAmount) {
        Price price = Price.builder().unitAmount(unitAmount).build();
        List<Item> data = new ArrayList<>();
        data.add(Item.builder().price(price).build());
        return Items.builder().data(data).build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Items {
        private List<Item> data;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        private String id;
        private Price price;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Price {
        private String id;
        private Long unitAmount;
        private String currency;
    }
}
