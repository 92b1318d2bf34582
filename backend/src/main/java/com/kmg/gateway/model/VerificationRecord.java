package com.kmg.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;

public record VerificationRecord(
        String serviceId,
        String lookupKey,
        JsonNode payload,
        String source,
        OffsetDateTime fetchedAt
) {
    public static final String LOCAL_SOURCE = "local";

    public VerificationRecord withSource(String value) {
        return new VerificationRecord(serviceId, lookupKey, payload, value, fetchedAt);
    }
}
