package com.flagship.pharmacy_ledger.stock;

import lombok.Value;

/**
 * Identity of a medicine batch. The ledger entity key is {@code medicineName|batchNumber}.
 */
@Value
public class BatchKey implements Comparable<BatchKey> {
    private static final String SEPARATOR = "|";

    String medicineName;
    String batchNumber;

    public static BatchKey of(String medicineName, String batchNumber) {
        if (medicineName == null || medicineName.isBlank()) {
            throw new IllegalArgumentException("Medicine name cannot be blank");
        }
        if (batchNumber == null || batchNumber.isBlank()) {
            throw new IllegalArgumentException("Batch number cannot be blank");
        }
        if (medicineName.contains(SEPARATOR) || batchNumber.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Medicine name and batch number cannot contain '|'");
        }
        return new BatchKey(medicineName.trim(), batchNumber.trim());
    }

    public static BatchKey parse(String entityKey) {
        int split = entityKey.indexOf(SEPARATOR);
        if (split <= 0 || split == entityKey.length() - 1) {
            throw new IllegalArgumentException("Not a batch key: " + entityKey);
        }
        return of(entityKey.substring(0, split), entityKey.substring(split + 1));
    }

    public String entityKey() {
        return medicineName + SEPARATOR + batchNumber;
    }

    @Override
    public int compareTo(BatchKey other) {
        return entityKey().compareTo(other.entityKey());
    }

    @Override
    public String toString() {
        return entityKey();
    }
}
