package com.fintech.donations.service.subscription;

import com.fintech.donations.entity.DonationFrequency;
import com.fintech.donations.service.settings.OrganizationTimezoneProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Next expected payment date of a recurring donation, as a calendar date in the
 * organisation's timezone.
 */
@Component
@RequiredArgsConstructor
public class NextPaymentDateCalculator {

    private final OrganizationTimezoneProvider timezoneProvider;

    public LocalDate fromToday(DonationFrequency frequency) {
        return from(timezoneProvider.today(), frequency);
    }

    public LocalDate from(LocalDate date, DonationFrequency frequency) {
        DonationFrequency effective = frequency == null ? DonationFrequency.MONTHLY : frequency;
        return effective.advance(date);
    }
}
