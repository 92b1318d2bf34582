package com.kmg.gateway.provider;

import java.time.Duration;

/**
 * A third-party source of verification records. Implementations may be slow or failing
 * independently of each other; callers bound every {@link #fetch} by {@link #timeout()}.
 */
public interface ExternalProvider {

    String id();

    /**
     * False when the endpoint or credential is missing. Unconfigured providers are skipped, not failed.
     */
    boolean isConfigured();

    Duration timeout();

    ProviderResponse fetch(String serviceId, String lookupKey, Duration timeout);
}
