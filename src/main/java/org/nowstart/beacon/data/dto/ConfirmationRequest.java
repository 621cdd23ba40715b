package org.nowstart.beacon.data.dto;

import jakarta.validation.constraints.NotBlank;

public record ConfirmationRequest(
        @NotBlank(message = "symbol is required")
        String symbol
) {
}
