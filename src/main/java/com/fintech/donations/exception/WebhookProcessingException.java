package com.fintech.donations.exception;

/**
 * A handler failed while applying an event. The event is marked FAILED in the
 * ledger and the request is answered with 500 so that Stripe redelivers it.
 */
public class WebhookProcessingException extends DonationLedgerException {

    private final String eventId;
    private final String eventType;

    public WebhookProcessingException(String eventId, String eventType, Throwable cause) {
        super(String.format("Failed to process event %s (%s): %s", eventId, eventType,
                cause.getMessage()), cause);
        this.eventId = eventId;
        this.eventType = eventType;
    }

    public String getEventId() {
        return eventId;
    }

    public String getEventType() {
        return eventType;
    }
}
