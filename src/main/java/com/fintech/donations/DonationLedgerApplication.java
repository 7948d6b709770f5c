package com.fintech.donations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Donation Webhook Ledger
 * <p>
 * Ingests Stripe webhook events and turns them into a durable ledger of donations,
 * recurring donations and campaign totals.
 * <p>
 * Key Features:
 * - Signature-verified webhook ingestion with an idempotency ledger
 * - Duplicate suppression across overlapping Stripe event types
 * - Year-scoped receipt numbering and transactional campaign totals
 * - Resilient processor lookups with retry and circuit breaker
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@EnableRetry
public class DonationLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DonationLedgerApplication.class, args);
    }
}
