package com.fintech.donations.scheduler;

import com.fintech.donations.entity.ProcessingState;
import com.fintech.donations.entity.WebhookEventRecord;
import com.fintech.donations.service.ledger.WebhookEventLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookLedgerMonitorTest {

    @Mock
    private WebhookEventLedger ledger;

    @InjectMocks
    private WebhookLedgerMonitor monitor;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(monitor, "monitorEnabled", true);
        ReflectionTestUtils.setField(monitor, "stuckAfterMinutes", 15L);
        ReflectionTestUtils.setField(monitor, "reviewAttempts", 3);
    }

    @Test
    @DisplayName("Queries stuck and repeatedly failing events with the configured thresholds")
    void queriesLedgerWithThresholds() {
        // Given
        WebhookEventRecord stuck = WebhookEventRecord.builder()
                .eventId("evt_stuck")
                .eventType("charge.refunded")
                .status(ProcessingState.STARTED)
                .processingStartedAt(LocalDateTime.of(2024, 6, 1, 9, 30))
                .build();
        when(ledger.findStuck(Duration.ofMinutes(15))).thenReturn(List.of(stuck));
        when(ledger.findNeedingReview(3)).thenReturn(List.of());

        // When
        monitor.checkLedger();

        // Then
        verify(ledger).findStuck(Duration.ofMinutes(15));
        verify(ledger).findNeedingReview(3);
    }

    @Test
    @DisplayName("Does nothing when disabled")
    void skipsWhenDisabled() {
        ReflectionTestUtils.setField(monitor, "monitorEnabled", false);

        monitor.checkLedger();

        verifyNoInteractions(ledger);
    }

    @Test
    @DisplayName("Store failure is logged, not propagated to the scheduler")
    void storeFailureDoesNotEscape() {
        when(ledger.findStuck(Duration.ofMinutes(15)))
                .thenThrow(new DataAccessResourceFailureException("database unavailable"));

        assertThatCode(() -> monitor.checkLedger()).doesNotThrowAnyException();
    }
}
