package com.fintech.donations.entity;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Billing frequency of a recurring donation, as sent in Stripe metadata.
 */
public enum DonationFrequency {
    WEEKLY("weekly"),
    FORTNIGHTLY("fortnightly"),
    MONTHLY("monthly"),
    YEARLY("yearly");

    private final String value;

    DonationFrequency(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Advances a calendar date by one billing interval.
     * Month and year steps clamp to the last valid day (Jan 31 + 1 month = Feb 28/29).
     */
    public LocalDate advance(LocalDate from) {
        return switch (this) {
            case WEEKLY -> from.plusWeeks(1);
            case FORTNIGHTLY -> from.plusWeeks(2);
            case MONTHLY -> from.plusMonths(1);
            case YEARLY -> from.plusYears(1);
        };
    }

    /**
     * Parses a metadata value. Missing or unknown values fall back to MONTHLY,
     * which is what the donation form sends when the donor does not choose.
     */
    public static DonationFrequency fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MONTHLY;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DonationFrequency frequency : values()) {
            if (frequency.value.equals(normalized)) {
                return frequency;
            }
        }
        return MONTHLY;
    }
}
