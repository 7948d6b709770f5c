package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.CheckoutSessionPayload;
import com.fintech.donations.dto.stripe.PaymentIntentPayload;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.DonationSource;
import com.fintech.donations.service.DonationRecordService;
import com.fintech.donations.service.notification.EmailTemplate;
import com.fintech.donations.service.processor.PaymentDetailsResolver;
import com.fintech.donations.service.subscription.SubscriptionLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CheckoutSessionCompletedHandlerTest {

    @Mock
    private DonationRecordService donationRecordService;

    @Mock
    private SubscriptionLifecycleService subscriptionLifecycleService;

    @Mock
    private PaymentDetailsResolver paymentDetailsResolver;

    private CheckoutSessionCompletedHandler handler;

    @BeforeEach
    void setUp() {
        handler = new CheckoutSessionCompletedHandler(donationRecordService, subscriptionLifecycleService,
                paymentDetailsResolver);
    }

    @Test
    @DisplayName("Payment-mode session records a one-time donation")
    void recordsOneTimeDonation() {
        // Given
        Map<String, String> metadata = new HashMap<>();
        metadata.put("donor_email", "form@example.org");
        metadata.put("donor_phone", "0400 000 000");
        metadata.put("donation_type_label", "Building Fund");
        metadata.put("campaign_id", "roof");
        metadata.put("donor_message", "Keep it up");
        CheckoutSessionPayload session = session(CheckoutSessionPayload.MODE_PAYMENT, metadata);
        session.setCustomerDetails(CheckoutSessionPayload.CustomerDetails.builder()
                .email("checkout@example.org").name("  Alex Donor ").build());
        when(donationRecordService.isAlreadyRecorded("pi_1", "cs_1", null)).thenReturn(false);
        when(paymentDetailsResolver.paymentIntent("pi_1")).thenReturn(Optional.of(PaymentIntentPayload.builder()
                .id("pi_1").paymentMethod("pm_1").latestCharge("ch_1").build()));

        // When
        handler.handle(session, new WebhookEvent());

        // Then
        ArgumentCaptor<Donation> draft = ArgumentCaptor.forClass(Donation.class);
        verify(donationRecordService).recordDonation(draft.capture(), eq("pm_1"), eq("ch_1"),
                eq(EmailTemplate.ONE_TIME_RECEIPT));
        Donation donation = draft.getValue();
        assertThat(donation.getSource()).isEqualTo(DonationSource.CHECKOUT);
        assertThat(donation.getCheckoutSessionId()).isEqualTo("cs_1");
        assertThat(donation.getPaymentIntentId()).isEqualTo("pi_1");
        assertThat(donation.getAmount()).isEqualTo(5000L);
        assertThat(donation.getDonorEmail()).isEqualTo("checkout@example.org");
        assertThat(donation.getDonorName()).isEqualTo("Alex Donor");
        assertThat(donation.getDonorPhone()).isEqualTo("0400 000 000");
        assertThat(donation.getDonationTypeLabel()).isEqualTo("Building Fund");
        assertThat(donation.getDonorMessage()).isEqualTo("Keep it up");
    }

    @Test
    @DisplayName("Session already recorded is skipped")
    void skipsRecordedSession() {
        when(donationRecordService.isAlreadyRecorded("pi_1", "cs_1", null)).thenReturn(true);

        handler.handle(session(CheckoutSessionPayload.MODE_PAYMENT, new HashMap<>()), new WebhookEvent());

        verify(donationRecordService, never()).recordDonation(any(), any(), any(), any());
        verifyNoInteractions(paymentDetailsResolver);
    }

    @Test
    @DisplayName("Subscription-mode session only backfills donor details")
    void subscriptionModeBackfills() {
        CheckoutSessionPayload session = session(CheckoutSessionPayload.MODE_SUBSCRIPTION, new HashMap<>());
        session.setSubscription("sub_1");
        session.setCustomerDetails(CheckoutSessionPayload.CustomerDetails.builder()
                .email("checkout@example.org").name("Alex").build());

        handler.handle(session, new WebhookEvent());

        verify(subscriptionLifecycleService).backfillDonorDetails("sub_1", "checkout@example.org", "Alex");
        verifyNoInteractions(donationRecordService);
    }

    @Test
    @DisplayName("Setup-mode session is ignored")
    void setupModeIgnored() {
        handler.handle(session("setup", new HashMap<>()), new WebhookEvent());

        verifyNoInteractions(donationRecordService, subscriptionLifecycleService, paymentDetailsResolver);
    }

    private static CheckoutSessionPayload session(String mode, Map<String, String> metadata) {
        return CheckoutSessionPayload.builder()
                .id("cs_1")
                .mode(mode)
                .amountTotal(5000L)
                .currency("aud")
                .paymentIntent("pi_1")
                .paymentStatus("paid")
                .metadata(metadata)
                .build();
    }
}
