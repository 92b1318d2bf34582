package com.kmg.gateway.model;

public record Entitlement(String keyId, String callerId, String serviceId) {
}
