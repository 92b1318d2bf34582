package com.kmg.gateway.model;

/**
 * Handle for a pending charge. The amount has already been taken from the balance
 * when the token is issued.
 */
public record ReservationToken(String reservationId, String callerId, long amount) {
}
