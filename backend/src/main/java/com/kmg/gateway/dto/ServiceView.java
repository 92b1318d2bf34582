package com.kmg.gateway.dto;

import com.kmg.gateway.model.ServiceDefinition;

public record ServiceView(
        String id,
        String name,
        int cost
) {
    public static ServiceView from(ServiceDefinition definition) {
        return new ServiceView(definition.id(), definition.name(), definition.cost());
    }
}
