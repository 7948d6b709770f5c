package com.fintech.donations.service.notification;

import java.util.Map;

/**
 * Outbound email channel.
 */
public interface NotificationDispatcher {

    /**
     * Requests an email.
     *
     * @param template  which email to send
     * @param recipient destination address
     * @param data      flat template variables
     * @return true if the mail service accepted the request
     */
    boolean dispatch(EmailTemplate template, String recipient, Map<String, Object> data);
}
