package org.nowstart.beacon.data.dto;

import java.time.Instant;

public record CooldownState(
        Instant cooldownUntil
) {

    public boolean isActive(Instant now) {
        return cooldownUntil != null && now.isBefore(cooldownUntil);
    }
}
