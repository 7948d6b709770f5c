package com.fintech.donations.controller;

import com.fintech.donations.dto.LedgerStats;
import com.fintech.donations.entity.PaymentStatus;
import com.fintech.donations.entity.SubscriptionStatus;
import com.fintech.donations.entity.WebhookEventRecord;
import com.fintech.donations.repository.DonationRepository;
import com.fintech.donations.repository.RecurringDonationRepository;
import com.fintech.donations.service.ledger.WebhookEventLedger;
import com.fintech.donations.service.settings.OrganizationTimezoneProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Operational API over the webhook ledger.
 * <p>
 * Provides endpoints for:
 * - Inspecting a single event and events needing manual review
 * - Ledger statistics and health
 * - Reloading the organisation timezone after it was changed
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Ledger", description = "Webhook ledger operations API")
public class WebhookLedgerController {

    private final WebhookEventLedger ledger;
    private final DonationRepository donationRepository;
    private final RecurringDonationRepository recurringDonationRepository;
    private final OrganizationTimezoneProvider timezoneProvider;

    @Operation(
            summary = "Get event by ID",
            description = "Returns the ledger record of a Stripe event."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Event found",
                    content = @Content(schema = @Schema(implementation = WebhookEventRecord.class))),
            @ApiResponse(responseCode = "404", description = "Event never received")
    })
    @GetMapping("/events/{eventId}")
    public ResponseEntity<WebhookEventRecord> getEvent(
            @Parameter(description = "Stripe event ID") @PathVariable String eventId) {
        return ledger.find(eventId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(
            summary = "Get events needing manual review",
            description = "Returns events that have not completed after the given number of attempts."
    )
    @ApiResponse(responseCode = "200", description = "Events needing review retrieved successfully")
    @GetMapping("/events/needs-review")
    public ResponseEntity<List<WebhookEventRecord>> getEventsNeedingReview(
            @Parameter(description = "Minimum processing attempts threshold") @RequestParam(defaultValue = "3") int minAttempts) {
        return ResponseEntity.ok(ledger.findNeedingReview(minAttempts));
    }

    @Operation(
            summary = "Get ledger statistics",
            description = "Returns event counts by processing state, donation counts by payment status and recurring donation counts by status."
    )
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = LedgerStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<LedgerStats> getStats() {
        return ResponseEntity.ok(collectStats());
    }

    @Operation(
            summary = "Health check",
            description = "Returns the health status of the ledger. Used by load balancers and monitoring systems."
    )
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        LedgerStats stats = collectStats();

        Map<String, Object> health = Map.of(
                "status", "UP",
                "ledger", Map.of(
                        "startedEvents", stats.getStartedEvents(),
                        "completedEvents", stats.getCompletedEvents(),
                        "failedEvents", stats.getFailedEvents()
                ),
                "timezone", timezoneProvider.getZoneId().getId()
        );

        return ResponseEntity.ok(health);
    }

    @Operation(
            summary = "Reload organisation timezone",
            description = "Re-reads the timezone from organisation settings. Call after changing it."
    )
    @ApiResponse(responseCode = "200", description = "Timezone reloaded")
    @PostMapping("/settings/timezone/refresh")
    public ResponseEntity<Map<String, String>> refreshTimezone() {
        ZoneId zone = timezoneProvider.refresh();
        log.info("Organisation timezone reloaded via API: {}", zone);
        return ResponseEntity.ok(Map.of("timezone", zone.getId()));
    }

    private LedgerStats collectStats() {
        return ledger.getStats().toBuilder()
                .succeededDonations(donationRepository.countByPaymentStatus(PaymentStatus.SUCCEEDED))
                .refundedDonations(donationRepository.countByPaymentStatus(PaymentStatus.REFUNDED))
                .disputedDonations(donationRepository.countByPaymentStatus(PaymentStatus.DISPUTED))
                .activeSubscriptions(recurringDonationRepository.countByStatus(SubscriptionStatus.ACTIVE))
                .pastDueSubscriptions(recurringDonationRepository.countByStatus(SubscriptionStatus.PAST_DUE))
                .cancelledSubscriptions(recurringDonationRepository.countByStatus(SubscriptionStatus.CANCELLED))
                .build();
    }
}
