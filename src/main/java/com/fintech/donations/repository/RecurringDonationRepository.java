package com.fintech.donations.repository;

import com.fintech.donations.entity.RecurringDonation;
import com.fintech.donations.entity.SubscriptionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecurringDonationRepository extends JpaRepository<RecurringDonation, String>,
        JpaSpecificationExecutor<RecurringDonation> {

    long countByStatus(SubscriptionStatus status);

    List<RecurringDonation> findByDonorEmailIgnoreCaseOrderByCreatedAtDesc(String donorEmail);
}
