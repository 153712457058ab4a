package com.flagship.pharmacy_ledger.intake;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Wire format of an intake record: {@code {"documentType": ..., "payload": {...}}}.
 * The payload is bound to the matching request DTO once the type is known.
 */
@Value
public class IntakeEnvelope {
    IntakeDocumentType documentType;
    JsonNode payload;
}
