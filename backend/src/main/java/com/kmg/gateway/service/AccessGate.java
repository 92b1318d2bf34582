package com.kmg.gateway.service;

import com.kmg.gateway.model.ApiKeyGrant;
import com.kmg.gateway.model.Entitlement;
import com.kmg.gateway.model.FailureReason;
import com.kmg.gateway.repo.ApiKeyRepository;
import org.springframework.stereotype.Service;

/**
 * Checks that an API key exists, is active and is entitled to the requested service.
 * Read-only: nothing is written while authorizing.
 */
@Service
public class AccessGate {
    private final ApiKeyRepository apiKeyRepository;

    public AccessGate(ApiKeyRepository apiKeyRepository) {
        this.apiKeyRepository = apiKeyRepository;
    }

    public Entitlement authorize(String apiKey, String serviceId) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new GatewayException(FailureReason.UNAUTHENTICATED, "API key is missing");
        }

        ApiKeyGrant grant = apiKeyRepository.findByHash(ApiKeyService.hash(apiKey.trim()))
                .filter(ApiKeyGrant::active)
                .orElseThrow(() -> new GatewayException(FailureReason.UNAUTHENTICATED, "Invalid API key"));

        if (!grant.isEntitledTo(serviceId)) {
            throw new GatewayException(
                    FailureReason.FORBIDDEN,
                    "API key does not have access to service '" + serviceId + "'",
                    grant.callerId(),
                    grant.keyId()
            );
        }
        return new Entitlement(grant.keyId(), grant.callerId(), serviceId);
    }
}
