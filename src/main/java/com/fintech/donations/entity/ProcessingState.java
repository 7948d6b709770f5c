package com.fintech.donations.entity;

/**
 * Processing state of a webhook event in the idempotency ledger.
 * An event with no ledger row has not been seen yet.
 */
public enum ProcessingState {
    /**
     * A delivery is being (or was last being) processed.
     */
    STARTED,

    /**
     * All effects of the event were applied. Terminal.
     */
    COMPLETED,

    /**
     * The last attempt threw. Stripe will redeliver and the event is processed again.
     */
    FAILED
}
