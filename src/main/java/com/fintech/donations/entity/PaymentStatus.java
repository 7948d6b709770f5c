package com.fintech.donations.entity;

/**
 * Payment status of a recorded donation.
 */
public enum PaymentStatus {
    SUCCEEDED,
    REFUNDED,
    DISPUTED
}
