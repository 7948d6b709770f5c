package com.fintech.donations.dto;

import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.RecurringDonation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of donations plus the recurring donations matching the same donor filters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DonationSearchResult {

    private List<Donation> donations;
    private List<RecurringDonation> recurringDonations;
    private long totalCount;
    private int page;
    private int size;
    private boolean hasMore;
}
