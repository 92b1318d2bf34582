package com.kmg.gateway.model;

import java.time.OffsetDateTime;
import java.util.List;

public record ServiceDefinition(
        String id,
        String name,
        boolean active,
        List<String> fallbackChain,
        int cost,
        OffsetDateTime updatedAt
) {
    public ServiceDefinition {
        fallbackChain = fallbackChain == null ? List.of() : List.copyOf(fallbackChain);
    }

    public ServiceDefinition withActive(boolean value) {
        return new ServiceDefinition(id, name, value, fallbackChain, cost, updatedAt);
    }
}
