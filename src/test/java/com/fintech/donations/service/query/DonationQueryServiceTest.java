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
import com.fintech.donations.repository.RecurringDonationRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DonationQueryServiceTest {

    @Mock
    private DonationRepository donationRepository;

    @Mock
    private RecurringDonationRepository recurringDonationRepository;

    @InjectMocks
    private DonationQueryService queryService;

    @Nested
    @DisplayName("findByDonorEmail")
    class FindByDonorEmailTests {

        @Test
        @DisplayName("Email is trimmed and lowercased before the lookup")
        void normalizesEmail() {
            // Given
            Donation donation = Donation.builder().id(1L).donorEmail("Jane@Example.org").build();
            RecurringDonation recurring = RecurringDonation.builder().subscriptionId("sub_1").build();
            when(donationRepository.findByDonorEmailIgnoreCaseAndRecurringFalseOrderByCreatedAtDesc("jane@example.org"))
                    .thenReturn(List.of(donation));
            when(recurringDonationRepository.findByDonorEmailIgnoreCaseOrderByCreatedAtDesc("jane@example.org"))
                    .thenReturn(List.of(recurring));

            // When
            DonorDonations result = queryService.findByDonorEmail("  Jane@Example.ORG ");

            // Then
            assertThat(result.getEmail()).isEqualTo("jane@example.org");
            assertThat(result.getDonations()).containsExactly(donation);
            assertThat(result.getSubscriptions()).containsExactly(recurring);
        }

        @Test
        @DisplayName("Blank email is rejected without querying")
        void rejectsBlankEmail() {
            assertThatThrownBy(() -> queryService.findByDonorEmail("   "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Email is required");

            verifyNoInteractions(donationRepository, recurringDonationRepository);
        }
    }

    @Nested
    @DisplayName("search")
    class SearchTests {

        @Test
        @DisplayName("Filters are normalised and the page is reported with its total")
        void normalisesFiltersAndPages() {
            // Given
            DonationSearchCriteria criteria = DonationSearchCriteria.builder()
                    .from(LocalDate.of(2024, 1, 1))
                    .to(LocalDate.of(2024, 3, 31))
                    .donationTypeId(" general ")
                    .paymentStatus(PaymentStatus.SUCCEEDED)
                    .recurring(false)
                    .donorEmail(" A@B.org")
                    .donorName(" Smi ")
                    .build();
            Donation donation = Donation.builder().id(7L).build();
            RecurringDonation recurring = RecurringDonation.builder().subscriptionId("sub_1").build();
            PageRequest pageRequest = PageRequest.of(1, 10, DonationQueryService.NEWEST_FIRST);
            when(donationRepository.findAll(any(Specification.class), eq(pageRequest)))
                    .thenReturn(new PageImpl<>(List.of(donation), pageRequest, 25));
            when(recurringDonationRepository.findAll(any(Specification.class), any(Sort.class)))
                    .thenReturn(List.of(recurring));

            // When
            DonationSearchResult result = queryService.search(criteria, 1, 10);

            // Then
            assertThat(result.getDonations()).containsExactly(donation);
            assertThat(result.getRecurringDonations()).containsExactly(recurring);
            assertThat(result.getTotalCount()).isEqualTo(25);
            assertThat(result.getPage()).isEqualTo(1);
            assertThat(result.getSize()).isEqualTo(10);
            assertThat(result.isHasMore()).isTrue();
        }

        @Test
        @DisplayName("Empty criteria do not filter and the last page has no more")
        void emptyCriteria() {
            PageRequest pageRequest = PageRequest.of(0, 50, DonationQueryService.NEWEST_FIRST);
            when(donationRepository.findAll(any(Specification.class), eq(pageRequest)))
                    .thenReturn(new PageImpl<>(List.of(), pageRequest, 0));
            when(recurringDonationRepository.findAll(any(Specification.class), any(Sort.class)))
                    .thenReturn(List.of());

            DonationSearchResult result = queryService.search(new DonationSearchCriteria(), 0, 50);

            assertThat(result.getTotalCount()).isZero();
            assertThat(result.isHasMore()).isFalse();
        }

        @Test
        @DisplayName("Page size outside 1..200 is rejected")
        void rejectsPageSize() {
            DonationSearchCriteria criteria = new DonationSearchCriteria();

            assertThatThrownBy(() -> queryService.search(criteria, 0, 0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> queryService.search(criteria, 0, 201))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(donationRepository, recurringDonationRepository);
        }

        @Test
        @DisplayName("Start date after end date is rejected")
        void rejectsReversedDates() {
            DonationSearchCriteria criteria = DonationSearchCriteria.builder()
                    .from(LocalDate.of(2024, 5, 1))
                    .to(LocalDate.of(2024, 4, 1))
                    .build();

            assertThatThrownBy(() -> queryService.search(criteria, 0, 50))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Start date is after end date");
        }
    }

    @Test
    @DisplayName("Summary totals succeeded donations by type and month")
    void summarize() {
        // Given
        when(donationRepository.countByPaymentStatus(PaymentStatus.SUCCEEDED)).thenReturn(3L);
        when(donationRepository.sumAmountByPaymentStatus(PaymentStatus.SUCCEEDED)).thenReturn(10_000L);
        when(donationRepository.countByPaymentStatusAndRecurring(PaymentStatus.SUCCEEDED, true)).thenReturn(1L);
        when(donationRepository.countByPaymentStatusAndRecurring(PaymentStatus.SUCCEEDED, false)).thenReturn(2L);
        when(recurringDonationRepository.countByStatus(SubscriptionStatus.ACTIVE)).thenReturn(4L);
        when(donationRepository.getTypeTotals(PaymentStatus.SUCCEEDED)).thenReturn(List.of(
                new Object[]{"general", 2L, 7_000L},
                new Object[]{null, 1L, 3_000L}));
        when(donationRepository.getStatusCounts()).thenReturn(List.<Object[]>of(
                new Object[]{PaymentStatus.SUCCEEDED, 3L},
                new Object[]{PaymentStatus.REFUNDED, 1L}));
        when(donationRepository.getMonthlyTotals(PaymentStatus.SUCCEEDED)).thenReturn(List.of(
                new Object[]{2024, 3, 2L, 6_000L},
                new Object[]{2024, 11, 1L, 4_000L}));

        // When
        DonationSummary summary = queryService.summarize();

        // Then
        assertThat(summary.getDonationCount()).isEqualTo(3);
        assertThat(summary.getTotalAmount()).isEqualTo(10_000L);
        assertThat(summary.getAverageDonation()).isEqualTo(3_333L);
        assertThat(summary.getRecurringCount()).isEqualTo(1);
        assertThat(summary.getOneTimeCount()).isEqualTo(2);
        assertThat(summary.getActiveRecurringCount()).isEqualTo(4);
        assertThat(summary.getByType())
                .containsEntry("general", new DonationSummary.Bucket(2, 7_000L))
                .containsEntry("unknown", new DonationSummary.Bucket(1, 3_000L));
        assertThat(summary.getByStatus())
                .containsEntry("SUCCEEDED", 3L)
                .containsEntry("REFUNDED", 1L)
                .containsEntry("DISPUTED", 0L);
        assertThat(summary.getByMonth()).containsOnlyKeys("2024-03", "2024-11");
        assertThat(summary.getByMonth().get("2024-03").getAmount()).isEqualTo(6_000L);
    }

    @Test
    @DisplayName("Summary of an empty ledger averages to zero")
    void summarizeEmpty() {
        when(donationRepository.countByPaymentStatus(PaymentStatus.SUCCEEDED)).thenReturn(0L);
        when(donationRepository.sumAmountByPaymentStatus(PaymentStatus.SUCCEEDED)).thenReturn(0L);

        DonationSummary summary = queryService.summarize();

        assertThat(summary.getAverageDonation()).isZero();
        assertThat(summary.getByType()).isEmpty();
        assertThat(summary.getByMonth()).isEmpty();
    }
}
