package com.fintech.donations.repository;

import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.PaymentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DonationRepository extends JpaRepository<Donation, Long>, JpaSpecificationExecutor<Donation> {

    Optional<Donation> findFirstByPaymentIntentId(String paymentIntentId);

    boolean existsByPaymentIntentId(String paymentIntentId);

    boolean existsByCheckoutSessionId(String checkoutSessionId);

    boolean existsByInvoiceId(String invoiceId);

    Optional<Donation> findByReceiptNumber(String receiptNumber);

    List<Donation> findBySubscriptionIdOrderByCreatedAtAsc(String subscriptionId);

    long countByPaymentStatus(PaymentStatus status);

    /**
     * Sum of donation amounts for a subscription in the given status.
     * Used for the lifetime total shown on cancellation.
     */
    @Query("SELECT COALESCE(SUM(d.amount), 0) FROM Donation d " +
            "WHERE d.subscriptionId = :subscriptionId AND d.paymentStatus = :status")
    long sumAmountBySubscriptionIdAndStatus(@Param("subscriptionId") String subscriptionId,
                                            @Param("status") PaymentStatus status);

    /**
     * One-time donations made under an email address, newest first.
     * Installments are reported through the donor's recurring donations.
     */
    List<Donation> findByDonorEmailIgnoreCaseAndRecurringFalseOrderByCreatedAtDesc(String donorEmail);

    long countByPaymentStatusAndRecurring(PaymentStatus status, boolean recurring);

    @Query("SELECT COALESCE(SUM(d.amount), 0) FROM Donation d WHERE d.paymentStatus = :status")
    long sumAmountByPaymentStatus(@Param("status") PaymentStatus status);

    /**
     * Rows of [paymentStatus, count].
     */
    @Query("SELECT d.paymentStatus, COUNT(d) FROM Donation d GROUP BY d.paymentStatus")
    List<Object[]> getStatusCounts();

    /**
     * Rows of [donationTypeId, count, amount] for donations in the given status.
     */
    @Query("SELECT d.donationTypeId, COUNT(d), COALESCE(SUM(d.amount), 0) FROM Donation d " +
            "WHERE d.paymentStatus = :status GROUP BY d.donationTypeId")
    List<Object[]> getTypeTotals(@Param("status") PaymentStatus status);

    /**
     * Rows of [year, month, count, amount] for donations in the given status.
     */
    @Query("SELECT EXTRACT(YEAR FROM d.donationDate), EXTRACT(MONTH FROM d.donationDate), " +
            "COUNT(d), COALESCE(SUM(d.amount), 0) FROM Donation d " +
            "WHERE d.paymentStatus = :status " +
            "GROUP BY EXTRACT(YEAR FROM d.donationDate), EXTRACT(MONTH FROM d.donationDate)")
    List<Object[]> getMonthlyTotals(@Param("status") PaymentStatus status);
}
