package com.kmg.gateway.model;

import java.time.OffsetDateTime;

public record CreditReservation(
        String id,
        String callerId,
        long amount,
        ReservationState state,
        OffsetDateTime createdAt,
        OffsetDateTime settledAt
) {
}
