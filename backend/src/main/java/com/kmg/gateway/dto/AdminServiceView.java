package com.kmg.gateway.dto;

import com.kmg.gateway.model.ServiceDefinition;
import com.kmg.gateway.repo.SqlTime;

import java.util.List;

public record AdminServiceView(
        String id,
        String name,
        boolean active,
        int cost,
        List<String> fallbackChain,
        String updatedAt
) {
    public static AdminServiceView from(ServiceDefinition definition) {
        return new AdminServiceView(
                definition.id(),
                definition.name(),
                definition.active(),
                definition.cost(),
                definition.fallbackChain(),
                SqlTime.text(definition.updatedAt())
        );
    }
}
