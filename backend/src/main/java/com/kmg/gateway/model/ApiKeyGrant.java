package com.kmg.gateway.model;

import java.time.OffsetDateTime;
import java.util.Set;

public record ApiKeyGrant(
        String keyId,
        String callerId,
        String keyHash,
        String label,
        Set<String> entitledServices,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime lastUsedAt
) {
    public static final String ALL_SERVICES = "*";

    public ApiKeyGrant {
        entitledServices = entitledServices == null ? Set.of() : Set.copyOf(entitledServices);
    }

    public boolean isEntitledTo(String serviceId) {
        return entitledServices.contains(ALL_SERVICES) || entitledServices.contains(serviceId);
    }
}
