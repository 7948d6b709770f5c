package com.fintech.donations.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.entity.ProcessingState;
import com.fintech.donations.entity.WebhookEventRecord;
import com.fintech.donations.exception.WebhookProcessingException;
import com.fintech.donations.exception.WebhookSignatureException;
import com.fintech.donations.service.handler.WebhookEventDispatcher;
import com.fintech.donations.service.handler.WebhookEventType;
import com.fintech.donations.service.ledger.LedgerCheck;
import com.fintech.donations.service.ledger.WebhookEventLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookProcessingServiceTest {

    private static final String PAYLOAD = "{}";
    private static final String SIGNATURE = "t=1,v1=abc";

    @Mock
    private WebhookSignatureVerifier signatureVerifier;

    @Mock
    private WebhookEventLedger ledger;

    @Mock
    private WebhookEventDispatcher dispatcher;

    private SimpleMeterRegistry meterRegistry;
    private WebhookProcessingService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new WebhookProcessingService(signatureVerifier, ledger, dispatcher, meterRegistry);
        service.initMetrics();
    }

    @Test
    @DisplayName("New event is dispatched and marked completed")
    void processesNewEvent() {
        // Given
        WebhookEvent event = event("evt_1", "charge.refunded");
        when(signatureVerifier.verifyAndParse(PAYLOAD, SIGNATURE)).thenReturn(event);
        when(ledger.checkProcessed("evt_1")).thenReturn(LedgerCheck.unseen());
        when(ledger.markStarted("evt_1", "charge.refunded")).thenReturn(true);

        // When
        ProcessingOutcome outcome = service.process(PAYLOAD, SIGNATURE);

        // Then
        assertThat(outcome).isEqualTo(ProcessingOutcome.PROCESSED);
        verify(dispatcher).dispatch(WebhookEventType.CHARGE_REFUNDED, event);
        verify(ledger).markCompleted("evt_1");
        assertThat(meterRegistry.get("webhook.events")
                .tag("outcome", "processed").tag("type", "charge.refunded")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("webhook.processing.duration").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unrecognised type is acknowledged without touching the ledger")
    void ignoresUnknownType() {
        when(signatureVerifier.verifyAndParse(PAYLOAD, SIGNATURE))
                .thenReturn(event("evt_2", "customer.created"));

        ProcessingOutcome outcome = service.process(PAYLOAD, SIGNATURE);

        assertThat(outcome).isEqualTo(ProcessingOutcome.IGNORED);
        verifyNoInteractions(ledger, dispatcher);
    }

    @Test
    @DisplayName("Completed event is reported as duplicate and not dispatched")
    void skipsCompletedEvent() {
        when(signatureVerifier.verifyAndParse(PAYLOAD, SIGNATURE))
                .thenReturn(event("evt_1", "charge.refunded"));
        WebhookEventRecord completed = WebhookEventRecord.builder()
                .eventId("evt_1").status(ProcessingState.COMPLETED).attemptCount(1).build();
        when(ledger.checkProcessed("evt_1")).thenReturn(LedgerCheck.of(completed));

        ProcessingOutcome outcome = service.process(PAYLOAD, SIGNATURE);

        assertThat(outcome).isEqualTo(ProcessingOutcome.DUPLICATE);
        verify(ledger, never()).markStarted(anyString(), anyString());
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("Event completed by a concurrent delivery is not dispatched")
    void skipsWhenStartRefused() {
        when(signatureVerifier.verifyAndParse(PAYLOAD, SIGNATURE))
                .thenReturn(event("evt_1", "charge.refunded"));
        when(ledger.checkProcessed("evt_1")).thenReturn(LedgerCheck.unseen());
        when(ledger.markStarted("evt_1", "charge.refunded")).thenReturn(false);

        ProcessingOutcome outcome = service.process(PAYLOAD, SIGNATURE);

        assertThat(outcome).isEqualTo(ProcessingOutcome.DUPLICATE);
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("Handler failure marks the event failed and is rethrown for redelivery")
    void handlerFailure() {
        // Given
        WebhookEvent event = event("evt_1", "charge.refunded");
        when(signatureVerifier.verifyAndParse(PAYLOAD, SIGNATURE)).thenReturn(event);
        when(ledger.checkProcessed("evt_1")).thenReturn(LedgerCheck.unseen());
        when(ledger.markStarted("evt_1", "charge.refunded")).thenReturn(true);
        doThrow(new IllegalStateException("database unavailable"))
                .when(dispatcher).dispatch(WebhookEventType.CHARGE_REFUNDED, event);

        // When / Then
        assertThatThrownBy(() -> service.process(PAYLOAD, SIGNATURE))
                .isInstanceOf(WebhookProcessingException.class)
                .satisfies(e -> assertThat(((WebhookProcessingException) e).getEventId()).isEqualTo("evt_1"));

        verify(ledger).markFailed("evt_1", "IllegalStateException: database unavailable");
        verify(ledger, never()).markCompleted(anyString());
        assertThat(meterRegistry.get("webhook.events").tag("outcome", "failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Unauthenticated request is counted and rejected before the ledger")
    void rejectsBadSignature() {
        when(signatureVerifier.verifyAndParse(PAYLOAD, SIGNATURE))
                .thenThrow(new WebhookSignatureException("Invalid Stripe signature"));

        assertThatThrownBy(() -> service.process(PAYLOAD, SIGNATURE))
                .isInstanceOf(WebhookSignatureException.class);

        assertThat(meterRegistry.get("webhook.events.rejected").counter().count()).isEqualTo(1.0);
        verifyNoInteractions(ledger, dispatcher);
    }

    private static WebhookEvent event(String id, String type) {
        return WebhookEvent.builder()
                .id(id)
                .type(type)
                .data(WebhookEvent.EventData.builder()
                        .object(new ObjectMapper().createObjectNode())
                        .build())
                .build();
    }
}
