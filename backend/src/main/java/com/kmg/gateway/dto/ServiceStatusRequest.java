package com.kmg.gateway.dto;

import jakarta.validation.constraints.NotNull;

public record ServiceStatusRequest(
        @NotNull Boolean active
) {
}
