package com.fintech.donations.service;

import java.util.Locale;

/**
 * Rules for anonymous donors and deliverable email addresses.
 */
public final class DonorClassifier {

    /**
     * Address the donation form submits when the donor gives none.
     */
    public static final String PLACEHOLDER_EMAIL = "anonymous@donation.com";

    public static final String ANONYMOUS_NAME = "Anonymous";

    private DonorClassifier() {
    }

    /**
     * A donor is anonymous when no real email was given or the name is "Anonymous".
     */
    public static boolean isAnonymous(String email, String name) {
        if (!hasDeliverableEmail(email)) {
            return true;
        }
        return name != null && name.trim().equalsIgnoreCase(ANONYMOUS_NAME);
    }

    public static boolean hasDeliverableEmail(String email) {
        if (email == null || email.isBlank()) {
            return false;
        }
        return !email.trim().toLowerCase(Locale.ROOT).equals(PLACEHOLDER_EMAIL);
    }

    /**
     * Name to print on a receipt.
     */
    public static String displayName(String name) {
        return name == null || name.isBlank() ? ANONYMOUS_NAME : name.trim();
    }
}
