package com.kmg.gateway.model;

public enum GatewayStatus {
    SUCCESS,
    NOT_FOUND,
    FORBIDDEN,
    UNAUTHENTICATED,
    INSUFFICIENT_CREDITS,
    SERVICE_UNAVAILABLE
}
