package com.fintech.donations.exception;

/**
 * Base exception for donation ledger errors.
 */
public class DonationLedgerException extends RuntimeException {

    public DonationLedgerException(String message) {
        super(message);
    }

    public DonationLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
