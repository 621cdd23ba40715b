package org.nowstart.beacon.service.strategy.core;

import java.time.Instant;

public record MarketContext(
        String market,
        double percentChange24h,
        Double referenceVolatility,
        Double entryPrice,
        Double fundingRate,
        Instant nextFundingTime
) {

    public double volatilityProxy() {
        return referenceVolatility != null ? referenceVolatility : percentChange24h;
    }
}
