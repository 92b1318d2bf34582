package com.kmg.gateway.provider;

public class ProviderUnavailableException extends RuntimeException {
    private final String providerId;

    public ProviderUnavailableException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public ProviderUnavailableException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
