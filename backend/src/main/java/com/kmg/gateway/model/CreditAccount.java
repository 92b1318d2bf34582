package com.kmg.gateway.model;

import java.time.OffsetDateTime;

public record CreditAccount(
        String callerId,
        long balance,
        long version,
        OffsetDateTime updatedAt
) {
    public static CreditAccount empty(String callerId) {
        return new CreditAccount(callerId, 0, 0, null);
    }
}
