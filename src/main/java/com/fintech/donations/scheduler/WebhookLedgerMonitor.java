package com.fintech.donations.scheduler;

import com.fintech.donations.entity.WebhookEventRecord;
import com.fintech.donations.service.ledger.WebhookEventLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Periodically reports ledger entries that need attention.
 * <p>
 * Stripe redelivers failed events on its own, so nothing is reprocessed here.
 * The monitor only surfaces:
 * - events stuck in STARTED (the instance died mid-request)
 * - events that keep failing
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookLedgerMonitor {

    private final WebhookEventLedger ledger;

    @Value("${donations.monitor.enabled:true}")
    private boolean monitorEnabled;

    @Value("${donations.monitor.stuck-after-minutes:15}")
    private long stuckAfterMinutes;

    @Value("${donations.monitor.review-attempts:3}")
    private int reviewAttempts;

    @Scheduled(fixedDelayString = "${donations.monitor.interval-ms:300000}")
    public void checkLedger() {
        if (!monitorEnabled) {
            log.debug("Ledger monitor is disabled, skipping run");
            return;
        }

        try {
            List<WebhookEventRecord> stuck = ledger.findStuck(Duration.ofMinutes(stuckAfterMinutes));
            for (WebhookEventRecord record : stuck) {
                log.warn("Event {} ({}) started at {} and never finished",
                        record.getEventId(), record.getEventType(), record.getProcessingStartedAt());
            }

            List<WebhookEventRecord> needingReview = ledger.findNeedingReview(reviewAttempts);
            for (WebhookEventRecord record : needingReview) {
                log.warn("Event {} ({}) failed {} times, last error: {}",
                        record.getEventId(), record.getEventType(), record.getAttemptCount(), record.getLastError());
            }

            if (stuck.isEmpty() && needingReview.isEmpty()) {
                log.debug("Ledger check found nothing to report");
            } else {
                log.info("Ledger check: {} stuck, {} needing review", stuck.size(), needingReview.size());
            }
        } catch (Exception e) {
            log.error("Ledger check failed with unexpected error", e);
        }
    }
}
