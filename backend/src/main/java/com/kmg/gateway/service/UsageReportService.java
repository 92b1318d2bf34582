package com.kmg.gateway.service;

import com.kmg.gateway.model.UsageLogEntry;
import com.kmg.gateway.repo.UsageLogRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class UsageReportService {
    static final int MAX_LIMIT = 500;

    private final UsageLogRepository usageLogRepository;

    public UsageReportService(UsageLogRepository usageLogRepository) {
        this.usageLogRepository = usageLogRepository;
    }

    /**
     * Most recent entries first, optionally for one caller. The limit is clamped to [1, 500].
     */
    public List<UsageLogEntry> recent(String callerId, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        if (callerId == null || callerId.isBlank()) {
            return usageLogRepository.findRecent(bounded);
        }
        return usageLogRepository.findRecentByCaller(callerId, bounded);
    }
}
