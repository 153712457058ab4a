package com.flagship.pharmacy_ledger.exception;

import java.time.Instant;
import java.util.UUID;

public class AlreadyApprovedException extends LedgerException {

    private final UUID entryId;
    private final String approvedBy;
    private final Instant approvedAt;

    public AlreadyApprovedException(UUID entryId, String approvedBy, Instant approvedAt) {
        super(String.format("Bank entry %s was already approved by %s at %s", entryId, approvedBy, approvedAt));
        this.entryId = entryId;
        this.approvedBy = approvedBy;
        this.approvedAt = approvedAt;
    }

    public UUID getEntryId() {
        return entryId;
    }

    public String getApprovedBy() {
        return approvedBy;
    }

    public Instant getApprovedAt() {
        return approvedAt;
    }
}
