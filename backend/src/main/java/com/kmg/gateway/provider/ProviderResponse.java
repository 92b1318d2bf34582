package com.kmg.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;

public record ProviderResponse(Status status, JsonNode payload, String detail) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        UNAVAILABLE
    }

    public static ProviderResponse found(JsonNode payload) {
        return new ProviderResponse(Status.FOUND, payload, null);
    }

    public static ProviderResponse notFound(String detail) {
        return new ProviderResponse(Status.NOT_FOUND, null, detail);
    }

    public static ProviderResponse unavailable(String detail) {
        return new ProviderResponse(Status.UNAVAILABLE, null, detail);
    }

    public boolean isFound() {
        return status == Status.FOUND && payload != null;
    }
}
