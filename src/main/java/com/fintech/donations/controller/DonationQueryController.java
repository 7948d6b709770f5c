package com.fintech.donations.controller;

import com.fintech.donations.dto.DonationSearchCriteria;
import com.fintech.donations.dto.DonationSearchResult;
import com.fintech.donations.dto.DonationSummary;
import com.fintech.donations.dto.DonorDonations;
import com.fintech.donations.entity.PaymentStatus;
import com.fintech.donations.service.query.DonationQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Map;

/**
 * Read API over recorded donations.
 * <p>
 * Provides endpoints for:
 * - A donor's history by email
 * - Filtered, paged donation listing for administrators
 * - Donation totals by type, status and month
 */
@RestController
@RequestMapping("/api/v1/donations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Donations", description = "Donation history and reporting API")
public class DonationQueryController {

    private final DonationQueryService queryService;

    @Operation(
            summary = "Get a donor's donations",
            description = "Returns one-time donations and recurring donations for an email address. " +
                    "The email is matched case-insensitively."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Donations retrieved",
                    content = @Content(schema = @Schema(implementation = DonorDonations.class))),
            @ApiResponse(responseCode = "400", description = "Email missing")
    })
    @GetMapping("/by-email")
    public ResponseEntity<DonorDonations> getDonorDonations(
            @Parameter(description = "Donor email address") @RequestParam(required = false) String email) {
        return ResponseEntity.ok(queryService.findByDonorEmail(email));
    }

    @Operation(
            summary = "Search donations",
            description = "Returns a page of donations, newest first, with the recurring donations " +
                    "matching the same type, email and name filters."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Donations retrieved",
                    content = @Content(schema = @Schema(implementation = DonationSearchResult.class))),
            @ApiResponse(responseCode = "400", description = "Invalid filter or page")
    })
    @GetMapping
    public ResponseEntity<DonationSearchResult> searchDonations(
            @Parameter(description = "Earliest donation date, inclusive")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @Parameter(description = "Latest donation date, inclusive")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @Parameter(description = "Donation type ID") @RequestParam(required = false) String donationType,
            @Parameter(description = "Payment status") @RequestParam(required = false) PaymentStatus status,
            @Parameter(description = "Only recurring (true) or one-time (false) donations")
            @RequestParam(required = false) Boolean recurring,
            @Parameter(description = "Donor email, exact match") @RequestParam(required = false) String email,
            @Parameter(description = "Part of the donor name") @RequestParam(required = false) String name,
            @Parameter(description = "Page number, starting at 0") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "50") int size) {
        DonationSearchCriteria criteria = DonationSearchCriteria.builder()
                .from(from)
                .to(to)
                .donationTypeId(donationType)
                .paymentStatus(status)
                .recurring(recurring)
                .donorEmail(email)
                .donorName(name)
                .build();
        return ResponseEntity.ok(queryService.search(criteria, page, size));
    }

    @Operation(
            summary = "Get donation summary",
            description = "Returns totals over succeeded donations by type and month, and counts by payment status."
    )
    @ApiResponse(responseCode = "200", description = "Summary retrieved",
            content = @Content(schema = @Schema(implementation = DonationSummary.class)))
    @GetMapping("/summary")
    public ResponseEntity<DonationSummary> getSummary() {
        return ResponseEntity.ok(queryService.summarize());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(IllegalArgumentException e) {
        log.debug("Rejected donation query: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
