package com.fintech.donations.service.ledger;

import com.fintech.donations.entity.WebhookEventRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Result of looking an event up in the ledger before processing it.
 */
@Getter
@AllArgsConstructor
public class LedgerCheck {

    private final boolean alreadyCompleted;

    private final WebhookEventRecord record;

    public static LedgerCheck unseen() {
        return new LedgerCheck(false, null);
    }

    public static LedgerCheck of(WebhookEventRecord record) {
        return new LedgerCheck(record.isCompleted(), record);
    }

    public Optional<WebhookEventRecord> getRecord() {
        return Optional.ofNullable(record);
    }
}
