package com.kmg.gateway.dto;

public record EventMessage(
        String type,
        String callerId,
        String message,
        String timestamp,
        Object payload
) {
}
