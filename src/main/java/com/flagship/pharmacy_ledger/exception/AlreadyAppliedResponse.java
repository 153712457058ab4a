package com.flagship.pharmacy_ledger.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * Body returned when a submission repeats an event that was already applied.
 */
@Value
public class AlreadyAppliedResponse {
    public static final String ALREADY_APPLIED = "ALREADY_APPLIED";

    @JsonProperty("status")
    String status;

    @JsonProperty("external_id")
    String externalId;

    @JsonProperty("message")
    String message;

    @JsonProperty("timestamp")
    Instant timestamp;
}
