package com.fintech.donations.service;

import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.exception.WebhookProcessingException;
import com.fintech.donations.exception.WebhookSignatureException;
import com.fintech.donations.service.handler.WebhookEventDispatcher;
import com.fintech.donations.service.handler.WebhookEventType;
import com.fintech.donations.service.ledger.WebhookEventLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Entry point for a single webhook delivery.
 * <p>
 * Pipeline: verify signature -> recognise type -> ledger check -> mark started ->
 * dispatch -> mark completed (or failed). Nothing is written before the request is
 * authenticated, and a completed event is never dispatched again.
 */
@Service
@Slf4j
public class WebhookProcessingService {

    private static final String MDC_EVENT_ID = "eventId";
    private static final String MDC_EVENT_TYPE = "eventType";

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookEventLedger ledger;
    private final WebhookEventDispatcher dispatcher;
    private final MeterRegistry meterRegistry;

    private Counter rejectedCounter;
    private Timer processingTimer;

    public WebhookProcessingService(WebhookSignatureVerifier signatureVerifier,
                                    WebhookEventLedger ledger,
                                    WebhookEventDispatcher dispatcher,
                                    MeterRegistry meterRegistry) {
        this.signatureVerifier = signatureVerifier;
        this.ledger = ledger;
        this.dispatcher = dispatcher;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        rejectedCounter = Counter.builder("webhook.events.rejected")
                .description("Webhook requests that failed authentication")
                .register(meterRegistry);

        processingTimer = Timer.builder("webhook.processing.duration")
                .description("Time spent in event handlers")
                .register(meterRegistry);
    }

    /**
     * Processes one delivery.
     *
     * @param payload         raw request body
     * @param signatureHeader value of the Stripe-Signature header
     * @throws WebhookSignatureException  if the request is not authentic
     * @throws WebhookProcessingException if the handler failed; Stripe should redeliver
     */
    public ProcessingOutcome process(String payload, String signatureHeader) {
        WebhookEvent event;
        try {
            event = signatureVerifier.verifyAndParse(payload, signatureHeader);
        } catch (WebhookSignatureException e) {
            rejectedCounter.increment();
            throw e;
        }

        MDC.put(MDC_EVENT_ID, event.getId());
        MDC.put(MDC_EVENT_TYPE, event.getType());
        try {
            return processVerified(event);
        } finally {
            MDC.remove(MDC_EVENT_ID);
            MDC.remove(MDC_EVENT_TYPE);
        }
    }

    private ProcessingOutcome processVerified(WebhookEvent event) {
        Optional<WebhookEventType> recognised = WebhookEventType.fromStripeType(event.getType());
        if (recognised.isEmpty()) {
            log.debug("Ignoring unhandled event type {}", event.getType());
            count(ProcessingOutcome.IGNORED.name(), event.getType());
            return ProcessingOutcome.IGNORED;
        }
        WebhookEventType type = recognised.get();

        if (ledger.checkProcessed(event.getId()).isAlreadyCompleted()) {
            log.info("Event {} already processed, skipping", event.getId());
            count(ProcessingOutcome.DUPLICATE.name(), event.getType());
            return ProcessingOutcome.DUPLICATE;
        }

        if (!ledger.markStarted(event.getId(), event.getType())) {
            count(ProcessingOutcome.DUPLICATE.name(), event.getType());
            return ProcessingOutcome.DUPLICATE;
        }

        try {
            processingTimer.record(() -> dispatcher.dispatch(type, event));
        } catch (RuntimeException e) {
            log.error("Failed to process event {} ({}): {}", event.getId(), event.getType(), e.getMessage(), e);
            ledger.markFailed(event.getId(), e.getClass().getSimpleName() + ": " + e.getMessage());
            count("FAILED", event.getType());
            throw new WebhookProcessingException(event.getId(), event.getType(), e);
        }

        ledger.markCompleted(event.getId());
        count(ProcessingOutcome.PROCESSED.name(), event.getType());
        log.info("Processed event {} ({})", event.getId(), event.getType());
        return ProcessingOutcome.PROCESSED;
    }

    private void count(String outcome, String eventType) {
        Counter.builder("webhook.events")
                .description("Webhook events by outcome and type")
                .tag("outcome", outcome.toLowerCase(Locale.ROOT))
                .tag("type", eventType == null ? "unknown" : eventType)
                .register(meterRegistry)
                .increment();
    }
}
