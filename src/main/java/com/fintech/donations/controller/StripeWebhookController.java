package com.fintech.donations.controller;

import com.fintech.donations.dto.WebhookAcknowledgement;
import com.fintech.donations.exception.WebhookProcessingException;
import com.fintech.donations.exception.WebhookSignatureException;
import com.fintech.donations.service.ProcessingOutcome;
import com.fintech.donations.service.WebhookProcessingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives Stripe webhook deliveries.
 * <p>
 * The body is taken as a raw string because the signature covers the exact bytes sent.
 * 2xx tells Stripe the event is done; any other status makes it redeliver.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhooks", description = "Stripe webhook endpoint")
public class StripeWebhookController {

    private final WebhookProcessingService processingService;

    @Operation(
            summary = "Receive a Stripe event",
            description = "Verifies the Stripe-Signature header, records the event in the idempotency ledger and applies it to donations, recurring donations and campaign totals."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Event processed, already processed, or ignored",
                    content = @Content(schema = @Schema(implementation = WebhookAcknowledgement.class))),
            @ApiResponse(responseCode = "400", description = "Missing or invalid signature"),
            @ApiResponse(responseCode = "500", description = "Processing failed, Stripe will retry")
    })
    @PostMapping(value = "/stripe", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<WebhookAcknowledgement> receive(
            @Parameter(description = "Raw event JSON") @RequestBody String payload,
            @Parameter(description = "Stripe signature header")
            @RequestHeader(value = "Stripe-Signature", required = false) String signature) {

        ProcessingOutcome outcome = processingService.process(payload, signature);

        WebhookAcknowledgement acknowledgement = switch (outcome) {
            case PROCESSED -> WebhookAcknowledgement.processed();
            case DUPLICATE -> WebhookAcknowledgement.duplicate();
            case IGNORED -> WebhookAcknowledgement.ignored();
        };
        return ResponseEntity.ok(acknowledgement);
    }

    @ExceptionHandler(WebhookSignatureException.class)
    public ResponseEntity<Map<String, String>> handleSignatureFailure(WebhookSignatureException e) {
        log.warn("Rejected webhook: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(WebhookProcessingException.class)
    public ResponseEntity<Map<String, String>> handleProcessingFailure(WebhookProcessingException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Webhook processing failed", "eventId", e.getEventId()));
    }
}
