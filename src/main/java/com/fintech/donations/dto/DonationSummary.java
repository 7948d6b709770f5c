package com.fintech.donations.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Aggregates over succeeded donations. Amounts are in minor units (cents).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DonationSummary {

    private long donationCount;
    private long totalAmount;
    private long averageDonation;
    private long recurringCount;
    private long oneTimeCount;
    private long activeRecurringCount;

    /**
     * Keyed by donation type ID, "unknown" when a donation has none.
     */
    private Map<String, Bucket> byType;

    /**
     * Count of donations in every payment status, not only succeeded.
     */
    private Map<String, Long> byStatus;

    /**
     * Keyed by YYYY-MM of the donation date.
     */
    private Map<String, Bucket> byMonth;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bucket {
        private long count;
        private long amount;
    }
}
