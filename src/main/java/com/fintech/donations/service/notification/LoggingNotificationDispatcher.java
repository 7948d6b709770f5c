package com.fintech.donations.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Default dispatcher that only logs the email request.
 * In production this is replaced by the mail service integration.
 */
@Service
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Value("${donations.notifications.enabled:true}")
    private boolean enabled;

    @Override
    public boolean dispatch(EmailTemplate template, String recipient, Map<String, Object> data) {
        if (!enabled) {
            log.debug("Notifications disabled, not sending {} to {}", template.getTemplateId(), recipient);
            return false;
        }
        log.info("Email requested: template={}, recipient={}, fields={}",
                template.getTemplateId(), recipient, data.keySet());
        return true;
    }
}
