package com.kmg.gateway.service;

import com.kmg.gateway.config.GatewayProperties;
import com.kmg.gateway.model.FailureReason;
import com.kmg.gateway.model.ServiceDefinition;
import com.kmg.gateway.repo.ServiceDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.NoSuchElementException;

@Service
public class ServiceRegistry {
    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final ServiceDefinitionRepository repository;

    public ServiceRegistry(ServiceDefinitionRepository repository) {
        this.repository = repository;
    }

    /**
     * Returns the definition as it is stored right now. Callers keep the returned snapshot for the
     * rest of their request, so a later toggle does not affect them.
     */
    public ServiceDefinition resolveService(String serviceId) {
        ServiceDefinition definition = repository.findById(serviceId)
                .orElseThrow(() -> new GatewayException(
                        FailureReason.SERVICE_NOT_FOUND, "Service '" + serviceId + "' not found"));
        if (!definition.active()) {
            throw new GatewayException(FailureReason.SERVICE_INACTIVE, "Service '" + serviceId + "' is inactive");
        }
        return definition;
    }

    public ServiceDefinition findService(String serviceId) {
        return repository.findById(serviceId)
                .orElseThrow(() -> new NoSuchElementException("Service not found: " + serviceId));
    }

    public List<ServiceDefinition> listServices() {
        return repository.findAll();
    }

    public List<ServiceDefinition> listActiveServices() {
        return repository.findAll().stream().filter(ServiceDefinition::active).toList();
    }

    public ServiceDefinition setActive(String serviceId, boolean active) {
        if (!repository.setActive(serviceId, active)) {
            throw new NoSuchElementException("Service not found: " + serviceId);
        }
        log.info("Service {} is now {}", serviceId, active ? "active" : "inactive");
        return findService(serviceId);
    }

    public void syncFromConfig(List<GatewayProperties.Service> configured) {
        for (GatewayProperties.Service service : configured) {
            String name = service.getName() == null || service.getName().isBlank() ? service.getId() : service.getName();
            repository.upsertKeepingActiveFlag(new ServiceDefinition(
                    service.getId(),
                    name,
                    service.isActive(),
                    service.getFallbackChain(),
                    service.getCost(),
                    null
            ));
        }
        log.info("Service catalog synced. configured={}", configured.size());
    }
}
