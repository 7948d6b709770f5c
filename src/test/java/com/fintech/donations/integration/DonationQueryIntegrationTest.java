package com.fintech.donations.integration;

import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.DonationFrequency;
import com.fintech.donations.entity.DonationSource;
import com.fintech.donations.entity.PaymentStatus;
import com.fintech.donations.entity.RecurringDonation;
import com.fintech.donations.entity.SubscriptionStatus;
import com.fintech.donations.repository.DonationRepository;
import com.fintech.donations.repository.RecurringDonationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Donation read API against H2.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DonationQueryIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DonationRepository donationRepository;

    @Autowired
    private RecurringDonationRepository recurringDonationRepository;

    @BeforeEach
    void setUp() {
        donationRepository.deleteAll();
        recurringDonationRepository.deleteAll();

        donationRepository.save(donation("RCP-2024-00001", "Jane@Example.org", "Jane Donor", 5000L,
                LocalDate.of(2024, 3, 5), "general", PaymentStatus.SUCCEEDED, false));
        Donation installment = donation("RCP-2024-00002", "jane@example.org", "Jane Donor", 2000L,
                LocalDate.of(2024, 3, 20), "general", PaymentStatus.SUCCEEDED, true);
        installment.setSubscriptionId("sub_1");
        installment.setInvoiceId("in_1");
        installment.setSource(DonationSource.INVOICE);
        donationRepository.save(installment);
        donationRepository.save(donation("RCP-2024-00003", "sam@example.org", "Sam Smith", 3000L,
                LocalDate.of(2024, 4, 2), "zakat", PaymentStatus.REFUNDED, false));

        recurringDonationRepository.save(RecurringDonation.builder()
                .subscriptionId("sub_1")
                .customerId("cus_1")
                .donorEmail("jane@example.org")
                .donorName("Jane Donor")
                .amount(2000L)
                .currency("AUD")
                .frequency(DonationFrequency.MONTHLY)
                .status(SubscriptionStatus.ACTIVE)
                .donationTypeId("general")
                .build());
    }

    @Test
    @DisplayName("Donor history matches the email regardless of case and leaves installments to the subscription")
    void donorHistoryByEmail() throws Exception {
        mockMvc.perform(get("/api/v1/donations/by-email").param("email", "  JANE@example.org "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("jane@example.org"))
                .andExpect(jsonPath("$.donations", hasSize(1)))
                .andExpect(jsonPath("$.donations[0].receiptNumber").value("RCP-2024-00001"))
                .andExpect(jsonPath("$.subscriptions", hasSize(1)))
                .andExpect(jsonPath("$.subscriptions[0].subscriptionId").value("sub_1"));
    }

    @Test
    @DisplayName("Donor history without an email is a bad request")
    void donorHistoryRequiresEmail() throws Exception {
        mockMvc.perform(get("/api/v1/donations/by-email"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Email is required"));
    }

    @Test
    @DisplayName("Listing filters by status and recurring flag")
    void searchByStatusAndRecurring() throws Exception {
        mockMvc.perform(get("/api/v1/donations")
                        .param("status", "SUCCEEDED")
                        .param("recurring", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(1))
                .andExpect(jsonPath("$.donations[0].receiptNumber").value("RCP-2024-00001"))
                .andExpect(jsonPath("$.hasMore").value(false));
    }

    @Test
    @DisplayName("Listing by date range is newest first and paged")
    void searchByDateRangePaged() throws Exception {
        mockMvc.perform(get("/api/v1/donations")
                        .param("from", "2024-03-01")
                        .param("to", "2024-03-31")
                        .param("size", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(2))
                .andExpect(jsonPath("$.donations", hasSize(1)))
                .andExpect(jsonPath("$.donations[0].receiptNumber").value("RCP-2024-00002"))
                .andExpect(jsonPath("$.hasMore").value(true));
    }

    @Test
    @DisplayName("Listing matches part of the donor name")
    void searchByName() throws Exception {
        mockMvc.perform(get("/api/v1/donations").param("name", "SMI"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(1))
                .andExpect(jsonPath("$.donations[0].donorEmail").value("sam@example.org"))
                .andExpect(jsonPath("$.recurringDonations", hasSize(0)));
    }

    @Test
    @DisplayName("Oversized page is a bad request")
    void rejectsOversizedPage() throws Exception {
        mockMvc.perform(get("/api/v1/donations").param("size", "500"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Summary totals succeeded donations by type, status and month")
    void summary() throws Exception {
        mockMvc.perform(get("/api/v1/donations/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.donationCount").value(2))
                .andExpect(jsonPath("$.totalAmount").value(7000))
                .andExpect(jsonPath("$.averageDonation").value(3500))
                .andExpect(jsonPath("$.recurringCount").value(1))
                .andExpect(jsonPath("$.oneTimeCount").value(1))
                .andExpect(jsonPath("$.activeRecurringCount").value(1))
                .andExpect(jsonPath("$.byType.general.count").value(2))
                .andExpect(jsonPath("$.byStatus.REFUNDED").value(1))
                .andExpect(jsonPath("$.byStatus.DISPUTED").value(0))
                .andExpect(jsonPath("$.byMonth['2024-03'].amount").value(7000));
    }

    private static Donation donation(String receiptNumber, String email, String name, long amount,
                                     LocalDate date, String type, PaymentStatus status, boolean recurring) {
        return Donation.builder()
                .receiptNumber(receiptNumber)
                .donorEmail(email)
                .donorName(name)
                .amount(amount)
                .currency("AUD")
                .paymentStatus(status)
                .source(DonationSource.CHECKOUT)
                .recurring(recurring)
                .paymentIntentId("pi_" + receiptNumber)
                .donationTypeId(type)
                .donationDate(date)
                .build();
    }
}
