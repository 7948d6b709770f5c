package com.fintech.donations.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DonorClassifierTest {

    @Test
    @DisplayName("Donor without email is anonymous")
    void missingEmailIsAnonymous() {
        assertThat(DonorClassifier.isAnonymous(null, "Jane Doe")).isTrue();
        assertThat(DonorClassifier.isAnonymous("  ", "Jane Doe")).isTrue();
    }

    @Test
    @DisplayName("Placeholder email is anonymous regardless of case")
    void placeholderEmailIsAnonymous() {
        assertThat(DonorClassifier.isAnonymous("Anonymous@Donation.com", "Jane Doe")).isTrue();
        assertThat(DonorClassifier.hasDeliverableEmail("ANONYMOUS@DONATION.COM")).isFalse();
    }

    @Test
    @DisplayName("Name 'Anonymous' makes the donor anonymous even with a real email")
    void anonymousNameIsAnonymous() {
        assertThat(DonorClassifier.isAnonymous("jane@example.com", "  anonymous ")).isTrue();
        assertThat(DonorClassifier.hasDeliverableEmail("jane@example.com")).isTrue();
    }

    @Test
    @DisplayName("Named donor with real email is not anonymous")
    void namedDonorIsNotAnonymous() {
        assertThat(DonorClassifier.isAnonymous("jane@example.com", "Jane Doe")).isFalse();
        assertThat(DonorClassifier.isAnonymous("jane@example.com", null)).isFalse();
    }

    @Test
    @DisplayName("Display name defaults to Anonymous")
    void displayNameDefaults() {
        assertThat(DonorClassifier.displayName(null)).isEqualTo("Anonymous");
        assertThat(DonorClassifier.displayName(" ")).isEqualTo("Anonymous");
        assertThat(DonorClassifier.displayName(" Jane ")).isEqualTo("Jane");
    }
}
