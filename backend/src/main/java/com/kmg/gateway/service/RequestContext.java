package com.kmg.gateway.service;

import com.kmg.gateway.model.ReservationToken;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-request state shared between the HTTP layer and the pipeline. Once abandoned, provider
 * results arriving for the request are discarded and no credits are committed for it.
 */
public final class RequestContext {
    private final String requestId;
    private final AtomicBoolean abandoned = new AtomicBoolean(false);
    private final AtomicReference<ReservationToken> charged = new AtomicReference<>();

    private RequestContext(String requestId) {
        this.requestId = requestId;
    }

    public static RequestContext create() {
        return new RequestContext(UUID.randomUUID().toString());
    }

    public String requestId() {
        return requestId;
    }

    public void abandon() {
        abandoned.set(true);
    }

    public boolean isAbandoned() {
        return abandoned.get();
    }

    void markCharged(ReservationToken token) {
        charged.set(token);
    }

    /**
     * Hands out the committed charge at most once, so a refund for it can only happen once.
     */
    ReservationToken takeCharge() {
        return charged.getAndSet(null);
    }
}
