package com.kmg.gateway.model;

import java.time.OffsetDateTime;

public record UsageLogEntry(
        Long id,
        String callerId,
        String keyId,
        String serviceId,
        String lookupKey,
        UsageOutcome outcome,
        String failureCode,
        String source,
        long creditsCharged,
        long responseTimeMs,
        OffsetDateTime createdAt
) {
}
