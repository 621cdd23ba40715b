package org.nowstart.beacon.service.strategy.core;

import org.nowstart.beacon.data.type.MomentumStrength;

public record MomentumProfile(
        int score,
        MomentumStrength strength
) {
}
