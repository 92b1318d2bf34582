package com.kmg.gateway.service;

import com.kmg.gateway.model.UsageLogEntry;
import com.kmg.gateway.repo.ApiKeyRepository;
import com.kmg.gateway.repo.UsageLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class JdbcUsageLogger implements UsageLogger {
    private static final Logger log = LoggerFactory.getLogger(JdbcUsageLogger.class);

    private final UsageLogRepository usageLogRepository;
    private final ApiKeyRepository apiKeyRepository;

    public JdbcUsageLogger(UsageLogRepository usageLogRepository, ApiKeyRepository apiKeyRepository) {
        this.usageLogRepository = usageLogRepository;
        this.apiKeyRepository = apiKeyRepository;
    }

    @Override
    public void append(UsageLogEntry entry) {
        try {
            usageLogRepository.insert(entry);
        } catch (Exception e) {
            log.warn("Failed to write usage log for {}/{}: {}", entry.serviceId(), entry.lookupKey(), e.getMessage());
            return;
        }

        if (entry.keyId() != null) {
            try {
                apiKeyRepository.touchLastUsed(entry.keyId());
            } catch (Exception e) {
                log.debug("Failed to update last_used_at for key {}: {}", entry.keyId(), e.getMessage());
            }
        }
    }
}
