package com.kmg.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record KeyGrantsRequest(
        @NotEmpty List<@NotBlank String> services
) {
}
