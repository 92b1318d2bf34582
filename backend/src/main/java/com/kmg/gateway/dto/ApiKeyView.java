package com.kmg.gateway.dto;

import com.kmg.gateway.model.ApiKeyGrant;
import com.kmg.gateway.repo.SqlTime;

import java.util.List;

public record ApiKeyView(
        String keyId,
        String callerId,
        String label,
        List<String> services,
        boolean active,
        String createdAt,
        String lastUsedAt
) {
    public static ApiKeyView from(ApiKeyGrant grant) {
        return new ApiKeyView(
                grant.keyId(),
                grant.callerId(),
                grant.label(),
                grant.entitledServices().stream().sorted().toList(),
                grant.active(),
                SqlTime.text(grant.createdAt()),
                SqlTime.text(grant.lastUsedAt())
        );
    }
}
