package com.fintech.donations.service.handler;

import com.fintech.donations.dto.stripe.CustomerDetails;
import com.fintech.donations.dto.stripe.InvoicePayload;
import com.fintech.donations.dto.stripe.PaymentIntentPayload;
import com.fintech.donations.dto.stripe.SubscriptionPayload;
import com.fintech.donations.dto.stripe.WebhookEvent;
import com.fintech.donations.entity.Donation;
import com.fintech.donations.entity.DonationSource;
import com.fintech.donations.entity.RecurringDonation;
import com.fintech.donations.repository.RecurringDonationRepository;
import com.fintech.donations.service.DonationMetadata;
import com.fintech.donations.service.DonationRecordService;
import com.fintech.donations.service.notification.EmailTemplate;
import com.fintech.donations.service.processor.PaymentDetailsResolver;
import com.fintech.donations.service.subscription.SubscriptionLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Records each paid installment of a recurring donation.
 * <p>
 * The first invoice of a subscription sends no receipt: the donor has just had the
 * welcome email. Later invoices send the recurring receipt.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvoicePaymentSucceededHandler implements WebhookEventHandler<InvoicePayload> {

    private final DonationRecordService donationRecordService;
    private final SubscriptionLifecycleService subscriptionLifecycleService;
    private final RecurringDonationRepository recurringDonationRepository;
    private final PaymentDetailsResolver paymentDetailsResolver;

    @Override
    public WebhookEventType type() {
        return WebhookEventType.INVOICE_PAYMENT_SUCCEEDED;
    }

    @Override
    public Class<InvoicePayload> payloadType() {
        return InvoicePayload.class;
    }

    @Override
    public void handle(InvoicePayload invoice, WebhookEvent event) {
        String subscriptionId = invoice.resolveSubscriptionId();
        if (subscriptionId == null) {
            log.info("Invoice {} is not for a subscription, skipping", invoice.getId());
            return;
        }

        long amountPaid = invoice.getAmountPaid() == null ? 0L : invoice.getAmountPaid();
        if (amountPaid <= 0) {
            // Trial or fully discounted cycle, still an installment but the campaign is unchanged
            log.info("Invoice {} paid nothing, recording a zero installment", invoice.getId());
        }
        Donation recorded = null;
        if (donationRecordService.isAlreadyRecorded(invoice.getPaymentIntent(), null, invoice.getId())) {
            log.info("Invoice {} already recorded, skipping donation", invoice.getId());
        } else {
            recorded = recordInstallmentDonation(invoice, subscriptionId, amountPaid).orElse(null);
        }

        subscriptionLifecycleService.recordInstallment(subscriptionId, recorded);
    }

    private Optional<Donation> recordInstallmentDonation(InvoicePayload invoice, String subscriptionId,
                                                         long amountPaid) {
        Donation.DonationBuilder draft = Donation.builder()
                .amount(amountPaid)
                .currency(invoice.getCurrency())
                .source(DonationSource.INVOICE)
                .recurring(true)
                .paymentIntentId(invoice.getPaymentIntent())
                .invoiceId(invoice.getId())
                .subscriptionId(subscriptionId)
                .customerId(invoice.getCustomer());

        Optional<RecurringDonation> recurring = recurringDonationRepository.findById(subscriptionId);
        if (recurring.isPresent()) {
            RecurringDonation row = recurring.get();
            draft.donorEmail(row.getDonorEmail())
                    .donorName(row.getDonorName())
                    .recurringFrequency(row.getFrequency())
                    .donationTypeId(row.getDonationTypeId())
                    .donationTypeLabel(row.getDonationTypeLabel())
                    .campaignId(row.getCampaignId());
        } else {
            // Invoice delivered before customer.subscription.created
            Optional<SubscriptionPayload> subscription = paymentDetailsResolver.subscription(subscriptionId);
            DonationMetadata metadata = DonationMetadata.of(subscription.map(SubscriptionPayload::getMetadata).orElse(null));
            String email = metadata.donorEmail();
            String name = metadata.donorName();
            if (email == null) {
                Optional<CustomerDetails> customer = paymentDetailsResolver.customer(invoice.getCustomer());
                email = customer.map(CustomerDetails::getEmail).orElse(null);
                name = name != null ? name : customer.map(CustomerDetails::getName).orElse(null);
            }
            draft.donorEmail(email)
                    .donorName(name)
                    .recurringFrequency(metadata.frequency())
                    .donationTypeId(metadata.donationTypeId())
                    .donationTypeLabel(metadata.donationTypeLabel())
                    .campaignId(metadata.campaignId());
        }

        Optional<PaymentIntentPayload> paymentIntent = paymentDetailsResolver.paymentIntent(invoice.getPaymentIntent());
        String chargeId = invoice.getCharge() != null
                ? invoice.getCharge()
                : paymentIntent.map(PaymentIntentPayload::getLatestCharge).orElse(null);
        EmailTemplate receipt = invoice.isFirstInvoice() ? null : EmailTemplate.RECURRING_RECEIPT;
        if (receipt == null) {
            log.debug("First invoice {} of subscription {}, receipt email suppressed", invoice.getId(), subscriptionId);
        }

        return donationRecordService.recordDonation(draft.build(),
                paymentIntent.map(PaymentIntentPayload::getPaymentMethod).orElse(null),
                chargeId,
                receipt);
    }
}
