package com.kmg.gateway.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.kmg.gateway.provider.ExternalProvider;
import com.kmg.gateway.provider.ProviderResponse;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Scriptable in-memory provider. Counts invocations so tests can assert that no call was made.
 */
public class FakeProvider implements ExternalProvider {
    private final String id;
    private volatile boolean configured = true;
    private volatile Duration timeout = Duration.ofSeconds(2);
    private volatile Duration delay = Duration.ZERO;
    private volatile BiFunction<String, String, ProviderResponse> behaviour =
            (serviceId, key) -> ProviderResponse.notFound("no record");
    private final AtomicInteger calls = new AtomicInteger();

    public FakeProvider(String id) {
        this.id = id;
    }

    public FakeProvider unconfigured() {
        this.configured = false;
        return this;
    }

    public FakeProvider configured(boolean value) {
        this.configured = value;
        return this;
    }

    public FakeProvider returning(JsonNode payload) {
        this.behaviour = (serviceId, key) -> ProviderResponse.found(payload);
        return this;
    }

    public FakeProvider notFound() {
        this.behaviour = (serviceId, key) -> ProviderResponse.notFound("no record");
        return this;
    }

    public FakeProvider unavailable() {
        this.behaviour = (serviceId, key) -> ProviderResponse.unavailable("down");
        return this;
    }

    public FakeProvider throwing(RuntimeException failure) {
        this.behaviour = (serviceId, key) -> {
            throw failure;
        };
        return this;
    }

    public FakeProvider answering(BiFunction<String, String, ProviderResponse> behaviour) {
        this.behaviour = behaviour;
        return this;
    }

    public FakeProvider withTimeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public FakeProvider delayedBy(Duration delay) {
        this.delay = delay;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public void reset() {
        calls.set(0);
        configured = true;
        delay = Duration.ZERO;
        timeout = Duration.ofSeconds(2);
        notFound();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public ProviderResponse fetch(String serviceId, String lookupKey, Duration timeout) {
        calls.incrementAndGet();
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ProviderResponse.unavailable("interrupted");
            }
        }
        return behaviour.apply(serviceId, lookupKey);
    }
}
