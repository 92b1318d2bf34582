package com.kmg.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record VerificationRequest(
        @NotBlank @Size(max = 64) String lookupKey
) {
}
