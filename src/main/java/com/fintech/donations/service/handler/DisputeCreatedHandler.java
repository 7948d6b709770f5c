package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.DisputePayload;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.service.DonationRecordService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DisputeCreatedHandler implements WebhookEventHandler<DisputePayload> {

    private final DonationRecordService donationRecordService;

    @Override
    public WebhookEventType type() {
        return WebhookEventType.CHARGE_DISPUTE_CREATED;
    }

    @Override
    public Class<DisputePayload> payloadType() {
        return DisputePayload.class;
    }

    @Override
    public void handle(DisputePayload dispute, WebhookEvent event) {
        donationRecordService.recordDispute(dispute);
    }
}
