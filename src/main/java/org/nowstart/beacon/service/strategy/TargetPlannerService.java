package org.nowstart.beacon.service.strategy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.data.type.BollingerWidthClass;
import org.nowstart.beacon.data.type.MomentumStrength;
import org.nowstart.beacon.data.type.TradeDirection;
import org.nowstart.beacon.service.strategy.core.TargetPlan;
import org.nowstart.beacon.service.strategy.core.TargetPlanInput;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Service
@RefreshScope
@RequiredArgsConstructor
public class TargetPlannerService {

    private static final int WIDEN_BELOW_CONFIDENCE = 68;
    private static final int HIGH_RR_CONFIDENCE = 75;
    private static final BigDecimal BPS = BigDecimal.valueOf(10_000L);

    private final SignalProperties signalProperties;

    public Optional<TargetPlan> plan(TargetPlanInput input) {
        if (input.atr() == null || !Double.isFinite(input.atr()) || input.atr() <= 0.0) {
            return Optional.empty();
        }
        if (!input.direction().isTradable() || !(input.entryPrice() > 0.0)) {
            return Optional.empty();
        }

        BigDecimal entry = BigDecimal.valueOf(input.entryPrice());
        BigDecimal atr = BigDecimal.valueOf(input.atr());
        BigDecimal slMultiplier = stopLossMultiplier(input);
        BigDecimal riskReward = riskRewardRatio(input.confidence(), input.momentumStrength());

        BigDecimal slDistance = slMultiplier.multiply(atr)
                .max(entry.multiply(signalProperties.minSlBps()).divide(BPS));
        BigDecimal tpDistance = riskReward.multiply(slDistance)
                .max(entry.multiply(signalProperties.minTpBps()).divide(BPS));

        boolean isLong = input.direction() == TradeDirection.LONG;
        BigDecimal stopLoss = isLong ? entry.subtract(slDistance) : entry.add(slDistance);
        BigDecimal takeProfit = isLong ? entry.add(tpDistance) : entry.subtract(tpDistance);

        if (input.pricePrecision() != null) {
            int scale = input.pricePrecision();
            BigDecimal tick = BigDecimal.ONE.movePointLeft(scale);
            if (isLong) {
                stopLoss = stopLoss.setScale(scale, RoundingMode.FLOOR)
                        .min(entry.subtract(tick).setScale(scale, RoundingMode.FLOOR));
                takeProfit = takeProfit.setScale(scale, RoundingMode.CEILING)
                        .max(entry.add(tick).setScale(scale, RoundingMode.CEILING));
            } else {
                stopLoss = stopLoss.setScale(scale, RoundingMode.CEILING)
                        .max(entry.add(tick).setScale(scale, RoundingMode.CEILING));
                takeProfit = takeProfit.setScale(scale, RoundingMode.FLOOR)
                        .min(entry.subtract(tick).setScale(scale, RoundingMode.FLOOR));
            }
        }

        // 진입가가 너무 낮아 손절/익절 가격이 0 이하로 내려가면 계획 불가
        BigDecimal downside = isLong ? stopLoss : takeProfit;
        if (downside.signum() <= 0) {
            return Optional.empty();
        }

        return Optional.of(new TargetPlan(
                stopLoss.doubleValue(),
                takeProfit.doubleValue(),
                input.atr(),
                slMultiplier.doubleValue(),
                riskReward.doubleValue()
        ));
    }

    BigDecimal stopLossMultiplier(TargetPlanInput input) {
        BigDecimal multiplier = signalProperties.slAtrMultLow();
        boolean widen = input.reversal()
                || input.confidence() < WIDEN_BELOW_CONFIDENCE
                || input.liquidationIntensity() >= signalProperties.liqThrMed()
                || input.bbWidthClass() == BollingerWidthClass.HIGH;
        if (widen) {
            multiplier = multiplier.max(signalProperties.slAtrMultWidened());
        }
        return multiplier.min(signalProperties.slAtrMultHigh());
    }

    BigDecimal riskRewardRatio(int confidence, MomentumStrength strength) {
        if (confidence >= HIGH_RR_CONFIDENCE && strength == MomentumStrength.STRONG) {
            return signalProperties.rrHigh();
        }
        return signalProperties.rrBase();
    }
}
