package com.fintech.donations.service;

import com.fintech.donations.entity.Campaign;
import com.fintech.donations.repository.CampaignRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CampaignAggregatorTest {

    @Mock
    private CampaignRepository campaignRepository;

    private CampaignAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new CampaignAggregator(campaignRepository,
                new TransactionTemplate(mock(PlatformTransactionManager.class)));
    }

    @Test
    @DisplayName("Adds the delta to the current amount")
    void addsDelta() {
        // Given
        Campaign campaign = Campaign.builder().id("roof").currentAmount(10_000L).build();
        when(campaignRepository.findById("roof")).thenReturn(Optional.of(campaign));
        when(campaignRepository.saveAndFlush(any(Campaign.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        boolean applied = aggregator.adjustTotal("roof", 2_500L);

        // Then
        assertThat(applied).isTrue();
        assertThat(campaign.getCurrentAmount()).isEqualTo(12_500L);
    }

    @Test
    @DisplayName("Negative delta reverses a contribution")
    void subtractsNegativeDelta() {
        Campaign campaign = Campaign.builder().id("roof").currentAmount(10_000L).build();
        when(campaignRepository.findById("roof")).thenReturn(Optional.of(campaign));
        when(campaignRepository.saveAndFlush(any(Campaign.class))).thenAnswer(inv -> inv.getArgument(0));

        aggregator.adjustTotal("roof", -4_000L);

        assertThat(campaign.getCurrentAmount()).isEqualTo(6_000L);
    }

    @Test
    @DisplayName("Missing campaign is reported, not thrown")
    void missingCampaign() {
        when(campaignRepository.findById("gone")).thenReturn(Optional.empty());

        boolean applied = aggregator.adjustTotal("gone", 100L);

        assertThat(applied).isFalse();
        verify(campaignRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("No campaign or zero delta does not touch the store")
    void noCampaignNoWork() {
        assertThat(aggregator.adjustTotal(null, 100L)).isFalse();
        assertThat(aggregator.adjustTotal("roof", 0L)).isFalse();
        verifyNoInteractions(campaignRepository);
    }

    @Test
    @DisplayName("Giving up after conflicts returns false")
    void recoveryReturnsFalse() {
        boolean result = aggregator.recoverAdjustTotal(
                new ObjectOptimisticLockingFailureException(Campaign.class, "roof"), "roof", 100L);

        assertThat(result).isFalse();
    }
}
