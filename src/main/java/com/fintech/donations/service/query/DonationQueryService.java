package com.fintech.donations.service.query;

import com.fintech.donations.dto.DonationSearchCriteria;
import com.fintech.donations.dto.DonationSearchResult;
import com.fintech.donations.dto.DonationSummary;
import com.fintech.donations.dto.DonorDonations;
import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.PaymentStatus;
import com.fintech.donations.entity.RecurringDonation;
import com.fintech.donations.entity.SubscriptionStatus;
import com.fintech.donations.repository.DonationRepository;
import com.fintech.donations.repository.DonationSpecifications;
import com.fintech.donations.repository.RecurringDonationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read side of the donation ledger: donor history and the admin listing and summary.
 * <p>
 * Emails are matched case-insensitively after trimming, because Stripe passes on
 * whatever the donor typed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DonationQueryService {

    static final int MAX_PAGE_SIZE = 200;
    static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "donationDate", "createdAt");
    private static final String UNKNOWN_TYPE = "unknown";

    private final DonationRepository donationRepository;
    private final RecurringDonationRepository recurringDonationRepository;

    /**
     * One-time donations and recurring donations made under an email address.
     *
     * @throws IllegalArgumentException if the email is blank
     */
    @Transactional(readOnly = true)
    public DonorDonations findByDonorEmail(String email) {
        String normalized = normalizeEmail(email);
        if (normalized == null) {
            throw new IllegalArgumentException("Email is required");
        }

        List<Donation> donations =
                donationRepository.findByDonorEmailIgnoreCaseAndRecurringFalseOrderByCreatedAtDesc(normalized);
        List<RecurringDonation> subscriptions =
                recurringDonationRepository.findByDonorEmailIgnoreCaseOrderByCreatedAtDesc(normalized);
        log.info("Donations retrieved for {}: {} one-time, {} recurring",
                normalized, donations.size(), subscriptions.size());

        return DonorDonations.builder()
                .email(normalized)
                .donations(donations)
                .subscriptions(subscriptions)
                .build();
    }

    @Transactional(readOnly = true)
    public DonationSearchResult search(DonationSearchCriteria criteria, int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("Page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (criteria.getFrom() != null && criteria.getTo() != null && criteria.getFrom().isAfter(criteria.getTo())) {
            throw new IllegalArgumentException("Start date is after end date");
        }

        String email = normalizeEmail(criteria.getDonorEmail());
        String namePattern = likePattern(criteria.getDonorName());
        String donationTypeId = blankToNull(criteria.getDonationTypeId());

        Page<Donation> result = donationRepository.findAll(
                DonationSpecifications.donationsMatching(
                        criteria.getFrom(),
                        criteria.getTo(),
                        donationTypeId,
                        criteria.getPaymentStatus(),
                        criteria.getRecurring(),
                        email,
                        namePattern),
                PageRequest.of(page, size, NEWEST_FIRST));
        List<RecurringDonation> recurring = recurringDonationRepository.findAll(
                DonationSpecifications.recurringDonationsMatching(donationTypeId, email, namePattern),
                Sort.by(Sort.Direction.DESC, "createdAt"));

        log.debug("Donation search {} returned {} of {}", criteria, result.getNumberOfElements(),
                result.getTotalElements());

        return DonationSearchResult.builder()
                .donations(result.getContent())
                .recurringDonations(recurring)
                .totalCount(result.getTotalElements())
                .page(page)
                .size(size)
                .hasMore(result.hasNext())
                .build();
    }

    /**
     * Totals over succeeded donations, grouped by type and month, with a count per status.
     */
    @Transactional(readOnly = true)
    public DonationSummary summarize() {
        long count = donationRepository.countByPaymentStatus(PaymentStatus.SUCCEEDED);
        long total = donationRepository.sumAmountByPaymentStatus(PaymentStatus.SUCCEEDED);

        Map<String, DonationSummary.Bucket> byType = new TreeMap<>();
        for (Object[] row : donationRepository.getTypeTotals(PaymentStatus.SUCCEEDED)) {
            String type = row[0] == null ? UNKNOWN_TYPE : (String) row[0];
            DonationSummary.Bucket bucket = byType.computeIfAbsent(type, key -> new DonationSummary.Bucket());
            bucket.setCount(bucket.getCount() + ((Number) row[1]).longValue());
            bucket.setAmount(bucket.getAmount() + ((Number) row[2]).longValue());
        }

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (PaymentStatus status : PaymentStatus.values()) {
            byStatus.put(status.name(), 0L);
        }
        for (Object[] row : donationRepository.getStatusCounts()) {
            byStatus.put(((PaymentStatus) row[0]).name(), ((Number) row[1]).longValue());
        }

        Map<String, DonationSummary.Bucket> byMonth = new TreeMap<>();
        for (Object[] row : donationRepository.getMonthlyTotals(PaymentStatus.SUCCEEDED)) {
            if (row[0] == null || row[1] == null) {
                continue;
            }
            String month = String.format(Locale.ROOT, "%04d-%02d",
                    ((Number) row[0]).intValue(), ((Number) row[1]).intValue());
            byMonth.put(month, new DonationSummary.Bucket(
                    ((Number) row[2]).longValue(), ((Number) row[3]).longValue()));
        }

        return DonationSummary.builder()
                .donationCount(count)
                .totalAmount(total)
                .averageDonation(count > 0 ? Math.round((double) total / count) : 0L)
                .recurringCount(donationRepository.countByPaymentStatusAndRecurring(PaymentStatus.SUCCEEDED, true))
                .oneTimeCount(donationRepository.countByPaymentStatusAndRecurring(PaymentStatus.SUCCEEDED, false))
                .activeRecurringCount(recurringDonationRepository.countByStatus(SubscriptionStatus.ACTIVE))
                .byType(byType)
                .byStatus(byStatus)
                .byMonth(byMonth)
                .build();
    }

    static String normalizeEmail(String email) {
        String value = blankToNull(email);
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static String likePattern(String name) {
        String value = blankToNull(name);
        return value == null ? null : "%" + value.toLowerCase(Locale.ROOT) + "%";
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
