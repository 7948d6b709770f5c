package com.fintech.donations.service;

/**
 * How a webhook delivery was handled.
 */
public enum ProcessingOutcome {
    /** Handler ran and the event is now COMPLETED. */
    PROCESSED,
    /** Event was already completed; nothing was done. */
    DUPLICATE,
    /** Event type is not one the ledger acts on. */
    IGNORED
}
