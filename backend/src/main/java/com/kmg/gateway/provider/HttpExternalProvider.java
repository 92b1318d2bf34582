package com.kmg.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kmg.gateway.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * Generic JSON-over-HTTP provider. Posts {@code {"<lookupField>": key}} to {@code <baseUrl>/<path>}
 * with the credential in the {@code X-API-Key} header.
 */
public class HttpExternalProvider implements ExternalProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpExternalProvider.class);
    static final String DEFAULT_LOOKUP_FIELD = "lookup_key";

    private final String id;
    private final GatewayProperties.Provider config;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public HttpExternalProvider(String id, GatewayProperties.Provider config, RestTemplate restTemplate,
                                ObjectMapper objectMapper) {
        this.id = id;
        this.config = config;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isConfigured() {
        return hasText(config.getBaseUrl()) && hasText(config.getCredential());
    }

    @Override
    public Duration timeout() {
        return config.getTimeout();
    }

    @Override
    public ProviderResponse fetch(String serviceId, String lookupKey, Duration timeout) {
        if (!isConfigured()) {
            return ProviderResponse.unavailable("Provider " + id + " is not configured");
        }

        String url = endpointUrl(serviceId);
        ObjectNode body = objectMapper.createObjectNode();
        body.put(lookupField(serviceId), lookupKey);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("X-API-Key", config.getCredential());

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    url,
                    HttpMethod.POST,
                    new HttpEntity<>(body, headers),
                    JsonNode.class
            );
            JsonNode payload = response.getBody();
            if (!response.getStatusCode().is2xxSuccessful() || payload == null || payload.isNull()) {
                return ProviderResponse.unavailable("Empty or non-success response " + response.getStatusCode().value());
            }
            JsonNode success = payload.path("success");
            if (success.isMissingNode() || success.isNull()) {
                log.warn("Provider {} answered {} without a success flag", id, serviceId);
                return ProviderResponse.unavailable("Response carries no success flag");
            }
            if (!success.asBoolean(false)) {
                return ProviderResponse.notFound(payload.path("message").asText("Provider reported no record"));
            }
            return ProviderResponse.found(payload);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return ProviderResponse.notFound("Provider " + id + " has no record");
            }
            log.warn("Provider {} answered {} for {}", id, e.getStatusCode().value(), serviceId);
            return ProviderResponse.unavailable("HTTP " + e.getStatusCode().value());
        } catch (RestClientException e) {
            log.warn("Provider {} call failed for {}: {}", id, serviceId, e.getMessage());
            return ProviderResponse.unavailable(e.getMessage());
        }
    }

    String endpointUrl(String serviceId) {
        GatewayProperties.Endpoint endpoint = config.getEndpoints().get(serviceId);
        String path = endpoint != null && hasText(endpoint.getPath()) ? endpoint.getPath() : serviceId;
        String base = config.getBaseUrl().endsWith("/")
                ? config.getBaseUrl().substring(0, config.getBaseUrl().length() - 1)
                : config.getBaseUrl();
        return base + "/" + (path.startsWith("/") ? path.substring(1) : path);
    }

    String lookupField(String serviceId) {
        GatewayProperties.Endpoint endpoint = config.getEndpoints().get(serviceId);
        return endpoint != null && hasText(endpoint.getLookupField()) ? endpoint.getLookupField() : DEFAULT_LOOKUP_FIELD;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
