package com.kmg.gateway.model;

public enum ReservationState {
    PENDING,
    COMMITTED,
    RELEASED
}
