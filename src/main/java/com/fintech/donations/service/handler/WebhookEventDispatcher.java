package com.fintech.donations.service.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.exception.DonationLedgerException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Routes a verified event to the single handler registered for its type.
 * <p>
 * The routing table is checked at start-up: every {@link WebhookEventType} must have
 * exactly one handler whose payload class matches the type.
 */
@Component
@Slf4j
public class WebhookEventDispatcher {

    private final List<WebhookEventHandler<?>> handlers;
    private final ObjectMapper objectMapper;
    private final Map<WebhookEventType, WebhookEventHandler<?>> routes =
            new EnumMap<>(WebhookEventType.class);

    public WebhookEventDispatcher(List<WebhookEventHandler<?>> handlers, ObjectMapper objectMapper) {
        this.handlers = handlers;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void buildRoutes() {
        for (WebhookEventHandler<?> handler : handlers) {
            WebhookEventType type = handler.type();
            if (!type.getPayloadType().equals(handler.payloadType())) {
                throw new IllegalStateException(String.format(
                        "Handler %s declares payload %s but %s carries %s",
                        handler.getClass().getSimpleName(), handler.payloadType().getSimpleName(),
                        type.getStripeType(), type.getPayloadType().getSimpleName()));
            }
            WebhookEventHandler<?> previous = routes.putIfAbsent(type, handler);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Both %s and %s handle %s",
                        previous.getClass().getSimpleName(), handler.getClass().getSimpleName(),
                        type.getStripeType()));
            }
        }

        List<String> missing = Arrays.stream(WebhookEventType.values())
                .filter(type -> !routes.containsKey(type))
                .map(WebhookEventType::getStripeType)
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No webhook handler registered for " + missing);
        }

        log.info("Registered {} webhook handlers", routes.size());
    }

    public void dispatch(WebhookEventType type, WebhookEvent event) {
        WebhookEventHandler<?> handler = routes.get(type);
        if (handler == null) {
            throw new IllegalStateException("No webhook handler registered for " + type.getStripeType());
        }
        invoke(handler, event);
    }

    private <T> void invoke(WebhookEventHandler<T> handler, WebhookEvent event) {
        T payload;
        try {
            payload = objectMapper.treeToValue(event.getData().getObject(), handler.payloadType());
        } catch (JsonProcessingException e) {
            throw new DonationLedgerException(String.format(
                    "Cannot read %s payload of event %s", event.getType(), event.getId()), e);
        }
        log.debug("Dispatching event {} to {}", event.getId(), handler.getClass().getSimpleName());
        handler.handle(payload, event);
    }
}
