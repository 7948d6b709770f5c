package com.fintech.donations.exception;

/**
 * The webhook request could not be authenticated or parsed.
 * Answered with 400 and never recorded in the ledger.
 */
public class WebhookSignatureException extends DonationLedgerException {

    public WebhookSignatureException(String message) {
        super(message);
    }

    public WebhookSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
