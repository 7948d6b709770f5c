package com.fintech.donations.dto;

import com.fintech.donations.entity.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Optional filters for the admin donation listing. Null fields do not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DonationSearchCriteria {

    /**
     * Inclusive bounds on the donation date (organisation timezone).
     */
    private LocalDate from;
    private LocalDate to;

    private String donationTypeId;
    private PaymentStatus paymentStatus;
    private Boolean recurring;

    /**
     * Exact match, case-insensitive.
     */
    private String donorEmail;

    /**
     * Substring match, case-insensitive.
     */
    private String donorName;
}
