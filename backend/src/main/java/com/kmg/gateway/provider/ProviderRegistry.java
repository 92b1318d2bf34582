package com.kmg.gateway.provider;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the external providers known at startup, keyed by provider id.
 */
public final class ProviderRegistry {
    private final Map<String, ExternalProvider> providers;

    public ProviderRegistry(Collection<? extends ExternalProvider> providers) {
        Map<String, ExternalProvider> byId = new LinkedHashMap<>();
        for (ExternalProvider provider : providers) {
            if (byId.putIfAbsent(provider.id(), provider) != null) {
                throw new IllegalArgumentException("Duplicate provider id: " + provider.id());
            }
        }
        this.providers = Collections.unmodifiableMap(byId);
    }

    public Optional<ExternalProvider> find(String providerId) {
        return Optional.ofNullable(providers.get(providerId));
    }

    public Collection<ExternalProvider> all() {
        return providers.values();
    }

    public boolean contains(String providerId) {
        return providers.containsKey(providerId);
    }
}
