package org.nowstart.beacon.service.strategy.core;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LiquidationSnapshot(
        double intensityScore,
        // +1 롱 청산 우세, -1 숏 청산 우세
        @JsonAlias("dirBias") int directionBias,
        double notionalSum
) {

    public static final LiquidationSnapshot NEUTRAL = new LiquidationSnapshot(0.0, 0, 0.0);
}
