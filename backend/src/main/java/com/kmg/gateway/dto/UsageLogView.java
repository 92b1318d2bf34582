package com.kmg.gateway.dto;

import com.kmg.gateway.model.UsageLogEntry;
import com.kmg.gateway.model.UsageOutcome;
import com.kmg.gateway.repo.SqlTime;

public record UsageLogView(
        long id,
        String callerId,
        String keyId,
        String serviceId,
        String lookupKey,
        UsageOutcome outcome,
        String failureCode,
        String source,
        long creditsCharged,
        long responseTimeMs,
        String createdAt
) {
    public static UsageLogView from(UsageLogEntry entry) {
        return new UsageLogView(
                entry.id() == null ? 0 : entry.id(),
                entry.callerId(),
                entry.keyId(),
                entry.serviceId(),
                entry.lookupKey(),
                entry.outcome(),
                entry.failureCode(),
                entry.source(),
                entry.creditsCharged(),
                entry.responseTimeMs(),
                SqlTime.text(entry.createdAt())
        );
    }
}
