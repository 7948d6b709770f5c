package com.fintech.donations.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts shown on the operations dashboard.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LedgerStats {

    private long startedEvents;
    private long completedEvents;
    private long failedEvents;

    private long succeededDonations;
    private long refundedDonations;
    private long disputedDonations;

    private long activeSubscriptions;
    private long pastDueSubscriptions;
    private long cancelledSubscriptions;
}
