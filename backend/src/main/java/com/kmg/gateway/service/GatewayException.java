package com.kmg.gateway.service;

import com.kmg.gateway.model.FailureReason;
import com.kmg.gateway.model.UsageOutcome;

public class GatewayException extends RuntimeException {
    private final FailureReason reason;
    private final UsageOutcome outcome;
    private final String callerId;
    private final String keyId;

    public GatewayException(FailureReason reason, String message) {
        this(reason, message, null, null);
    }

    public GatewayException(FailureReason reason, String message, UsageOutcome outcome) {
        super(message);
        this.reason = reason;
        this.outcome = outcome;
        this.callerId = null;
        this.keyId = null;
    }

    public GatewayException(FailureReason reason, String message, String callerId, String keyId) {
        super(message);
        this.reason = reason;
        this.outcome = reason.outcome();
        this.callerId = callerId;
        this.keyId = keyId;
    }

    public FailureReason getReason() {
        return reason;
    }

    /**
     * Outcome recorded in the usage log. Usually {@link FailureReason#outcome()}; a lookup that a
     * provider answered definitively with "no record" is NOT_FOUND rather than ERROR.
     */
    public UsageOutcome getOutcome() {
        return outcome;
    }

    public String getCallerId() {
        return callerId;
    }

    public String getKeyId() {
        return keyId;
    }
}
