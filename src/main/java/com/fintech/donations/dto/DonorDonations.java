package com.fintech.donations.dto;

import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.RecurringDonation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A donor's history: one-time donations and recurring donations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DonorDonations {

    private String email;
    private List<Donation> donations;
    private List<RecurringDonation> subscriptions;
}
