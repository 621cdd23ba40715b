package org.nowstart.beacon.service.strategy.core;

import org.nowstart.beacon.data.type.BollingerWidthClass;
import org.nowstart.beacon.data.type.MomentumStrength;
import org.nowstart.beacon.data.type.TradeDirection;

public record TargetPlanInput(
        double entryPrice,
        Double atr,
        TradeDirection direction,
        int confidence,
        MomentumStrength momentumStrength,
        boolean reversal,
        double liquidationIntensity,
        BollingerWidthClass bbWidthClass,
        // null 이면 틱 반올림 생략
        Integer pricePrecision
) {
}
