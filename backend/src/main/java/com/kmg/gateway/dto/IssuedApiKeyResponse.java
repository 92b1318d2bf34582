package com.kmg.gateway.dto;

/**
 * The raw key is only ever returned here, once, at creation time.
 */
public record IssuedApiKeyResponse(
        String apiKey,
        ApiKeyView key
) {
}
