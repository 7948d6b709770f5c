package com.fintech.donations.service;

import com.fintech.donations.entity.Campaign;
import com.fintech.donations.repository.CampaignRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Maintains campaign running totals.
 * <p>
 * Each adjustment is its own transaction, separate from the donation write. A failed
 * adjustment is logged and never undoes the donation.
 */
@Service
@Slf4j
public class CampaignAggregator {

    private final CampaignRepository campaignRepository;
    private final TransactionTemplate transactionTemplate;

    public CampaignAggregator(CampaignRepository campaignRepository,
                              TransactionTemplate transactionTemplate) {
        this.campaignRepository = campaignRepository;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Adds {@code delta} (negative for reversals) to the campaign's current amount.
     *
     * @return true if the total was changed
     */
    @Retryable(
            retryFor = ConcurrencyFailureException.class,
            maxAttempts = 10,
            backoff = @Backoff(delay = 20, maxDelay = 200, random = true)
    )
    public boolean adjustTotal(String campaignId, long delta) {
        if (campaignId == null || campaignId.isBlank() || delta == 0) {
            return false;
        }

        Boolean applied = transactionTemplate.execute(status -> {
            Optional<Campaign> found = campaignRepository.findById(campaignId);
            if (found.isEmpty()) {
                return false;
            }
            Campaign campaign = found.get();
            long current = campaign.getCurrentAmount() == null ? 0L : campaign.getCurrentAmount();
            campaign.setCurrentAmount(current + delta);
            campaignRepository.saveAndFlush(campaign);
            return true;
        });

        if (Boolean.TRUE.equals(applied)) {
            log.info("Adjusted campaign {} total by {}", campaignId, delta);
            return true;
        }
        log.warn("Campaign {} not found, total not adjusted by {}", campaignId, delta);
        return false;
    }

    @Recover
    public boolean recoverAdjustTotal(DataAccessException e, String campaignId, long delta) {
        log.error("Giving up adjusting campaign {} total by {}: {}", campaignId, delta, e.getMessage());
        return false;
    }
}
