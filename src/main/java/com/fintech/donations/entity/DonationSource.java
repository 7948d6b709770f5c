package com.fintech.donations.entity;

/**
 * The webhook path that recorded a donation.
 */
public enum DonationSource {
    /**
     * checkout.session.completed in payment mode.
     */
    CHECKOUT,

    /**
     * payment_intent.succeeded fallback for payments not seen through checkout.
     */
    PAYMENT_INTENT,

    /**
     * invoice.payment_succeeded, one installment of a recurring donation.
     */
    INVOICE
}
