package com.fintech.donations.exception;

/**
 * No donation exists yet for a payment that a later event (e.g. a dispute) refers to.
 * Retried a bounded number of times before the event is logged as unresolved.
 */
public class DonationNotYetRecordedException extends DonationLedgerException {

    private final String paymentIntentId;

    public DonationNotYetRecordedException(String paymentIntentId) {
        super("No donation recorded yet for payment intent " + paymentIntentId);
        this.paymentIntentId = paymentIntentId;
    }

    public String getPaymentIntentId() {
        return paymentIntentId;
    }
}
