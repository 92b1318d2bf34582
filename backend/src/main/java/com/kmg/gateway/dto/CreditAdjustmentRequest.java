package com.kmg.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreditAdjustmentRequest(
        @NotNull Long delta,
        @NotBlank String reason
) {
}
