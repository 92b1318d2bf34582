package com.kmg.gateway.model;

import org.springframework.http.HttpStatus;

public enum FailureReason {
    UNAUTHENTICATED(GatewayStatus.UNAUTHENTICATED, HttpStatus.UNAUTHORIZED, UsageOutcome.ERROR),
    FORBIDDEN(GatewayStatus.FORBIDDEN, HttpStatus.FORBIDDEN, UsageOutcome.ERROR),
    SERVICE_NOT_FOUND(GatewayStatus.SERVICE_UNAVAILABLE, HttpStatus.NOT_FOUND, UsageOutcome.ERROR),
    SERVICE_INACTIVE(GatewayStatus.SERVICE_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, UsageOutcome.ERROR),
    INSUFFICIENT_CREDITS(GatewayStatus.INSUFFICIENT_CREDITS, HttpStatus.PAYMENT_REQUIRED, UsageOutcome.ERROR),
    RECORD_NOT_FOUND(GatewayStatus.NOT_FOUND, HttpStatus.NOT_FOUND, UsageOutcome.ERROR),
    LEDGER_BUSY(GatewayStatus.SERVICE_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, UsageOutcome.ERROR),
    REQUEST_ABANDONED(GatewayStatus.SERVICE_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, UsageOutcome.ERROR),
    INTERNAL_ERROR(GatewayStatus.SERVICE_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, UsageOutcome.ERROR);

    private final GatewayStatus status;
    private final HttpStatus httpStatus;
    private final UsageOutcome outcome;

    FailureReason(GatewayStatus status, HttpStatus httpStatus, UsageOutcome outcome) {
        this.status = status;
        this.httpStatus = httpStatus;
        this.outcome = outcome;
    }

    public GatewayStatus status() {
        return status;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }

    public UsageOutcome outcome() {
        return outcome;
    }
}
