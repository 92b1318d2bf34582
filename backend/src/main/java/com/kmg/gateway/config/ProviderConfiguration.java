package com.kmg.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.gateway.provider.ExternalProvider;
import com.kmg.gateway.provider.HttpExternalProvider;
import com.kmg.gateway.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the provider registry once at startup: one {@link HttpExternalProvider} per entry under
 * {@code gateway.providers}, plus any {@link ExternalProvider} beans defined elsewhere.
 */
@Configuration
public class ProviderConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ProviderConfiguration.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(3);

    @Bean
    public ProviderRegistry providerRegistry(
            GatewayProperties properties,
            RestTemplateBuilder restTemplateBuilder,
            ObjectMapper objectMapper,
            ObjectProvider<ExternalProvider> additionalProviders
    ) {
        List<ExternalProvider> providers = new ArrayList<>();
        for (Map.Entry<String, GatewayProperties.Provider> entry : properties.getProviders().entrySet()) {
            GatewayProperties.Provider config = entry.getValue();
            RestTemplate restTemplate = restTemplateBuilder
                    .setConnectTimeout(CONNECT_TIMEOUT.compareTo(config.getTimeout()) < 0 ? CONNECT_TIMEOUT : config.getTimeout())
                    .setReadTimeout(config.getTimeout())
                    .build();
            HttpExternalProvider provider = new HttpExternalProvider(entry.getKey(), config, restTemplate, objectMapper);
            if (!provider.isConfigured()) {
                log.info("Provider {} has no base URL or credential; it will be skipped", entry.getKey());
            }
            providers.add(provider);
        }
        additionalProviders.orderedStream().forEach(providers::add);

        ProviderRegistry registry = new ProviderRegistry(providers);
        log.info("Provider registry ready. providers={}", registry.all().stream().map(ExternalProvider::id).toList());
        return registry;
    }
}
