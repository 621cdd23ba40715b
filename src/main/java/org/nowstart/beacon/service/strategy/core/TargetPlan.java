package org.nowstart.beacon.service.strategy.core;

public record TargetPlan(
        double stopLossPrice,
        double takeProfitPrice,
        double atrUsed,
        double slAtrMultiplier,
        double riskRewardRatio
) {
}
