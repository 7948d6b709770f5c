package com.fintech.donations.exception;

/**
 * Thrown when a lookup against the payment processor API fails.
 * This could be due to network issues, timeouts, rate limiting or an unknown object ID.
 */
public class ProcessorApiException extends DonationLedgerException {

    private final String processorName;
    private final String objectId;
    private final boolean isRetryable;

    public ProcessorApiException(String message, String processorName, String objectId) {
        this(message, processorName, objectId, true);
    }

    public ProcessorApiException(String message, String processorName, String objectId,
                                 boolean isRetryable) {
        super(message);
        this.processorName = processorName;
        this.objectId = objectId;
        this.isRetryable = isRetryable;
    }

    public ProcessorApiException(String message, String processorName, String objectId,
                                 boolean isRetryable, Throwable cause) {
        super(message, cause);
        this.processorName = processorName;
        this.objectId = objectId;
        this.isRetryable = isRetryable;
    }

    public String getProcessorName() {
        return processorName;
    }

    /**
     * ID of the processor object being looked up (payment intent, charge, subscription...).
     */
    public String getObjectId() {
        return objectId;
    }

    /**
     * Indicates if this error is transient and the lookup can be retried.
     * Unknown IDs and authentication failures are not retryable.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
