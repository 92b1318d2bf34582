package com.kmg.gateway.api;

import com.kmg.gateway.dto.ServiceView;
import com.kmg.gateway.model.ServiceDefinition;
import com.kmg.gateway.service.ServiceRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/v1/services")
public class ServiceCatalogController {
    private final ServiceRegistry serviceRegistry;

    public ServiceCatalogController(ServiceRegistry serviceRegistry) {
        this.serviceRegistry = serviceRegistry;
    }

    @GetMapping
    public List<ServiceView> list() {
        return serviceRegistry.listActiveServices().stream().map(ServiceView::from).toList();
    }

    @GetMapping("/{serviceId}")
    public ServiceView get(@PathVariable String serviceId) {
        ServiceDefinition definition = serviceRegistry.findService(serviceId);
        if (!definition.active()) {
            throw new NoSuchElementException("Service not found: " + serviceId);
        }
        return ServiceView.from(definition);
    }
}
