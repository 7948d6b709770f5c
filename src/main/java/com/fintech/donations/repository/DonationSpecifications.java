package com.fintech.donations.repository;

import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.PaymentStatus;
import com.fintech.donations.entity.RecurringDonation;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Query filters for the donation listing. A null argument adds no condition.
 * Email and name arguments must already be lowercase; {@code namePattern} is a LIKE pattern.
 */
public final class DonationSpecifications {

    private DonationSpecifications() {
    }

    public static Specification<Donation> donationsMatching(LocalDate from, LocalDate to, String donationTypeId,
                                                            PaymentStatus status, Boolean recurring,
                                                            String email, String namePattern) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (from != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDate>get("donationDate"), from));
            }
            if (to != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<LocalDate>get("donationDate"), to));
            }
            if (donationTypeId != null) {
                predicates.add(cb.equal(root.get("donationTypeId"), donationTypeId));
            }
            if (status != null) {
                predicates.add(cb.equal(root.get("paymentStatus"), status));
            }
            if (recurring != null) {
                predicates.add(cb.equal(root.get("recurring"), recurring));
            }
            if (email != null) {
                predicates.add(cb.equal(cb.lower(root.<String>get("donorEmail")), email));
            }
            if (namePattern != null) {
                predicates.add(cb.like(cb.lower(root.<String>get("donorName")), namePattern));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    public static Specification<RecurringDonation> recurringDonationsMatching(String donationTypeId, String email,
                                                                              String namePattern) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (donationTypeId != null) {
                predicates.add(cb.equal(root.get("donationTypeId"), donationTypeId));
            }
            if (email != null) {
                predicates.add(cb.equal(cb.lower(root.<String>get("donorEmail")), email));
            }
            if (namePattern != null) {
                predicates.add(cb.like(cb.lower(root.<String>get("donorName")), namePattern));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
