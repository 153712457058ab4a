package com.flagship.pharmacy_ledger.ledger;

import lombok.Value;

/**
 * External event a movement originates from.
 *
 * A reference without an id is a manual movement: it is recorded but never deduplicated.
 */
@Value
public class Reference {
    ReferenceType type;
    String id;

    public static Reference of(ReferenceType type, String id) {
        if (type == null) {
            throw new IllegalArgumentException("Reference type cannot be null");
        }
        if (id != null && id.isBlank()) {
            throw new IllegalArgumentException("Reference id cannot be blank");
        }
        return new Reference(type, id);
    }

    public static Reference manual() {
        return new Reference(ReferenceType.MANUAL, null);
    }

    public boolean isDeduplicated() {
        return id != null;
    }

    @Override
    public String toString() {
        return id == null ? type.name() : type.name() + "/" + id;
    }
}
