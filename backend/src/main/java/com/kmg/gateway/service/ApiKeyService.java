package com.kmg.gateway.service;

import com.kmg.gateway.model.ApiKeyGrant;
import com.kmg.gateway.repo.ApiKeyRepository;
import com.kmg.gateway.repo.ServiceDefinitionRepository;
import com.kmg.gateway.repo.SqlTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;

@Service
public class ApiKeyService {
    private static final Logger log = LoggerFactory.getLogger(ApiKeyService.class);
    private static final String KEY_PREFIX = "vg_";

    private final ApiKeyRepository apiKeyRepository;
    private final ServiceDefinitionRepository serviceRepository;
    private final SecureRandom random = new SecureRandom();

    public ApiKeyService(ApiKeyRepository apiKeyRepository, ServiceDefinitionRepository serviceRepository) {
        this.apiKeyRepository = apiKeyRepository;
        this.serviceRepository = serviceRepository;
    }

    public record IssuedKey(ApiKeyGrant grant, String rawKey) {
    }

    /**
     * Issues a new key. The raw key is only ever returned here; the store keeps its hash.
     */
    public IssuedKey issue(String callerId, String label, Collection<String> serviceIds) {
        if (callerId == null || callerId.isBlank()) {
            throw new IllegalArgumentException("callerId is required");
        }
        Set<String> services = validateServices(serviceIds);

        byte[] secret = new byte[32];
        random.nextBytes(secret);
        String rawKey = KEY_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(secret);

        ApiKeyGrant grant = new ApiKeyGrant(
                UUID.randomUUID().toString(),
                callerId,
                hash(rawKey),
                label,
                services,
                true,
                SqlTime.now(),
                null
        );
        apiKeyRepository.insert(grant);
        log.info("Issued API key {} for caller {} with {} grant(s)", grant.keyId(), callerId, services.size());
        return new IssuedKey(grant, rawKey);
    }

    public void revoke(String keyId) {
        if (!apiKeyRepository.setActive(keyId, false)) {
            throw new NoSuchElementException("API key not found: " + keyId);
        }
        log.info("Revoked API key {}", keyId);
    }

    public ApiKeyGrant replaceGrants(String keyId, Collection<String> serviceIds) {
        apiKeyRepository.findById(keyId).orElseThrow(() -> new NoSuchElementException("API key not found: " + keyId));
        apiKeyRepository.replaceGrants(keyId, validateServices(serviceIds));
        return apiKeyRepository.findById(keyId).orElseThrow();
    }

    public List<ApiKeyGrant> listKeys(String callerId) {
        return apiKeyRepository.findByCaller(callerId);
    }

    public static String hash(String rawKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(rawKey.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Set<String> validateServices(Collection<String> serviceIds) {
        if (serviceIds == null || serviceIds.isEmpty()) {
            throw new IllegalArgumentException("At least one service grant is required.");
        }
        Set<String> services = new LinkedHashSet<>();
        for (String serviceId : serviceIds) {
            String trimmed = serviceId == null ? "" : serviceId.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!ApiKeyGrant.ALL_SERVICES.equals(trimmed) && serviceRepository.findById(trimmed).isEmpty()) {
                throw new IllegalArgumentException("Unknown service: " + trimmed);
            }
            services.add(trimmed);
        }
        if (services.isEmpty()) {
            throw new IllegalArgumentException("At least one service grant is required.");
        }
        return services;
    }
}
