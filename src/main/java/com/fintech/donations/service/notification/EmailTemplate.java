package com.fintech.donations.service.notification;

/**
 * Emails the ledger can ask for. Rendering is done by the mail service.
 */
public enum EmailTemplate {
    ONE_TIME_RECEIPT("one-time-receipt"),
    RECURRING_WELCOME("recurring-welcome"),
    RECURRING_RECEIPT("recurring-receipt"),
    PAYMENT_FAILED("payment-failed"),
    SUBSCRIPTION_UPDATED("subscription-updated"),
    SUBSCRIPTION_CANCELLED("subscription-cancelled"),
    REFUND_CONFIRMATION("refund-confirmation"),
    DISPUTE_ALERT("dispute-alert");

    private final String templateId;

    EmailTemplate(String templateId) {
        this.templateId = templateId;
    }

    public String getTemplateId() {
        return templateId;
    }
}
