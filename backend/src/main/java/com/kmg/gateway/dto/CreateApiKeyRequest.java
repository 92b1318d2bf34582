package com.kmg.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CreateApiKeyRequest(
        @NotBlank String callerId,
        String label,
        @NotEmpty List<@NotBlank String> services
) {
}
