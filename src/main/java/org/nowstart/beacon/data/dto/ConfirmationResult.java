package org.nowstart.beacon.data.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfirmationResult(
        boolean ok,
        String reason
) {

    public static final String NO_PENDING_PREVIEW = "NO_PENDING_PREVIEW";

    public static ConfirmationResult accepted() {
        return new ConfirmationResult(true, null);
    }

    public static ConfirmationResult rejected(String reason) {
        return new ConfirmationResult(false, reason);
    }
}
