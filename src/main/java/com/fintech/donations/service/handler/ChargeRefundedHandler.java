package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.ChargePayload;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.service.DonationRecordService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChargeRefundedHandler implements WebhookEventHandler<ChargePayload> {

    private final DonationRecordService donationRecordService;

    @Override
    public WebhookEventType type() {
        return WebhookEventType.CHARGE_REFUNDED;
    }

    @Override
    public Class<ChargePayload> payloadType() {
        return ChargePayload.class;
    }

    @Override
    public void handle(ChargePayload charge, WebhookEvent event) {
        donationRecordService.recordRefund(charge);
    }
}
