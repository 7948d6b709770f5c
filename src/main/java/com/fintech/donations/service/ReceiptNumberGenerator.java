package com.fintech.donations.service;

import com.fintech.donations.entity.ReceiptCounter;
import com.fintech.donations.repository.ReceiptCounterRepository;
import com.fintech.donations.service.settings.OrganizationTimezoneProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Issues receipt numbers of the form {@code RCP-{year}-{00001}}.
 * <p>
 * One counter row per organisation-local calendar year. The increment is an
 * optimistic read-modify-write: concurrent callers conflict on the row version
 * (or on the insert of a new year's row) and the loser retries.
 */
@Service
@Slf4j
public class ReceiptNumberGenerator {

    private static final String PREFIX = "RCP";

    private final ReceiptCounterRepository counterRepository;
    private final OrganizationTimezoneProvider timezoneProvider;
    private final TransactionTemplate transactionTemplate;

    public ReceiptNumberGenerator(ReceiptCounterRepository counterRepository,
                                  OrganizationTimezoneProvider timezoneProvider,
                                  TransactionTemplate transactionTemplate) {
        this.counterRepository = counterRepository;
        this.timezoneProvider = timezoneProvider;
        this.transactionTemplate = transactionTemplate;
    }

    @Retryable(
            retryFor = {ConcurrencyFailureException.class, DataIntegrityViolationException.class},
            maxAttempts = 10,
            backoff = @Backoff(delay = 20, maxDelay = 200, random = true)
    )
    public String next() {
        int year = timezoneProvider.currentYear();
        Integer sequence = transactionTemplate.execute(status -> {
            ReceiptCounter counter = counterRepository.findById(year)
                    .orElseGet(() -> new ReceiptCounter(year));
            int value = counter.increment();
            counterRepository.saveAndFlush(counter);
            return value;
        });
        String receiptNumber = format(year, sequence);
        log.debug("Issued receipt number {}", receiptNumber);
        return receiptNumber;
    }

    public static String format(int year, int sequence) {
        return String.format("%s-%d-%05d", PREFIX, year, sequence);
    }
}
