package com.fintech.donations.service;

import com.fintech.donations.entity.DonationFrequency;

import java.util.Collections;
import java.util.Map;

/**
 * Typed view of the metadata the donation form attaches to Stripe objects.
 */
public class DonationMetadata {

    public static final String DEFAULT_DONATION_TYPE_LABEL = "General Donation";

    private final Map<String, String> values;

    private DonationMetadata(Map<String, String> values) {
        this.values = values == null ? Collections.emptyMap() : values;
    }

    public static DonationMetadata of(Map<String, String> metadata) {
        return new DonationMetadata(metadata);
    }

    public String donorEmail() {
        return get("donor_email");
    }

    public String donorName() {
        return get("donor_name");
    }

    public String donorPhone() {
        return get("donor_phone");
    }

    public String donationTypeId() {
        return get("donation_type_id");
    }

    public String donationTypeLabel() {
        String label = get("donation_type_label");
        return label == null ? DEFAULT_DONATION_TYPE_LABEL : label;
    }

    public String campaignId() {
        return get("campaign_id");
    }

    public String campaignName() {
        return get("campaign_name");
    }

    public DonationFrequency frequency() {
        return DonationFrequency.fromValue(get("frequency"));
    }

    public boolean hasFrequency() {
        return get("frequency") != null;
    }

    public boolean isRecurring() {
        return "true".equalsIgnoreCase(get("is_recurring"));
    }

    public String donorMessage() {
        return get("donor_message");
    }

    /**
     * Value for {@code key}, or null when absent or blank.
     */
    private String get(String key) {
        String value = values.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
