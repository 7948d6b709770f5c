package com.fintech.donations.entity;

import java.util.Locale;

/**
 * Lifecycle status of a recurring donation.
 * <p>
 * Allowed transitions: ACTIVE <-> PAST_DUE, ACTIVE -> CANCELLED, PAST_DUE -> CANCELLED.
 * CANCELLED is terminal.
 */
public enum SubscriptionStatus {
    ACTIVE,
    PAST_DUE,
    CANCELLED;

    public boolean canTransitionTo(SubscriptionStatus target) {
        if (target == null) {
            return false;
        }
        if (this == target) {
            return true;
        }
        return this != CANCELLED;
    }

    public boolean isTerminal() {
        return this == CANCELLED;
    }

    /**
     * Maps a Stripe subscription status onto the local lifecycle.
     * Unknown values are treated as ACTIVE.
     */
    public static SubscriptionStatus fromStripeStatus(String stripeStatus) {
        if (stripeStatus == null) {
            return ACTIVE;
        }
        return switch (stripeStatus.toLowerCase(Locale.ROOT)) {
            case "past_due", "unpaid", "incomplete" -> PAST_DUE;
            case "canceled", "cancelled", "incomplete_expired" -> CANCELLED;
            default -> ACTIVE;
        };
    }
}
