package org.nowstart.beacon.service.strategy;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.data.type.TradeDirection;
import org.nowstart.beacon.service.strategy.core.LiquidationSnapshot;
import org.nowstart.beacon.service.strategy.core.MarketContext;
import org.nowstart.beacon.service.strategy.core.RiskAdjustment;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Service
@RefreshScope
@RequiredArgsConstructor
public class LiquidationRiskService {

    public static final String LIQ_INTENSITY_HIGH = "LIQ_INTENSITY_HIGH";
    public static final String LIQ_INTENSITY_MED = "LIQ_INTENSITY_MED";
    public static final String LIQ_INTENSITY_LOW = "LIQ_INTENSITY_LOW";
    public static final String LIQ_ALIGNS_WITH_SIGNAL = "LIQ_ALIGNS_WITH_SIGNAL";
    public static final String FUNDING_RATE_HIGH = "FUNDING_RATE_HIGH";
    public static final String FUNDING_SOON_HIGH_RATE = "FUNDING_SOON_HIGH_RATE";

    private final SignalProperties signalProperties;

    public RiskAdjustment adjust(
            TradeDirection direction,
            int confidence,
            LiquidationSnapshot liquidation,
            MarketContext context,
            Instant now
    ) {
        LiquidationSnapshot liq = liquidation == null ? LiquidationSnapshot.NEUTRAL : liquidation;
        Set<String> warnings = new LinkedHashSet<>();
        int adjusted = confidence;
        double intensity = liq.intensityScore();

        // 청산 방향과 같은 쪽 포지션은 HIGH 구간에서 차단
        boolean veto = intensity >= signalProperties.liqThrHigh()
                && ((direction == TradeDirection.LONG && liq.directionBias() == 1)
                || (direction == TradeDirection.SHORT && liq.directionBias() == -1));

        if (intensity >= signalProperties.liqThrHigh()) {
            adjusted -= signalProperties.liqPenaltyHigh();
            warnings.add(LIQ_INTENSITY_HIGH);
        } else if (intensity >= signalProperties.liqThrMed()) {
            adjusted -= signalProperties.liqPenaltyMed();
            warnings.add(LIQ_INTENSITY_MED);
        } else if (intensity >= signalProperties.liqThrLow()) {
            adjusted -= signalProperties.liqPenaltyLow();
            warnings.add(LIQ_INTENSITY_LOW);
        }

        boolean contrarian = (direction == TradeDirection.SHORT && liq.directionBias() == 1)
                || (direction == TradeDirection.LONG && liq.directionBias() == -1);
        if (contrarian) {
            adjusted += signalProperties.liqBonusAlign();
            warnings.add(LIQ_ALIGNS_WITH_SIGNAL);
        }

        warnings.addAll(fundingWarnings(context, now));
        return new RiskAdjustment(ConfidenceScorerService.clamp(adjusted), veto, warnings);
    }

    Set<String> fundingWarnings(MarketContext context, Instant now) {
        Set<String> warnings = new LinkedHashSet<>();
        if (context == null || context.fundingRate() == null || !Double.isFinite(context.fundingRate())) {
            return warnings;
        }

        double threshold = signalProperties.fundingRateAbsWarn().doubleValue();
        if (Math.abs(context.fundingRate()) < threshold) {
            return warnings;
        }
        warnings.add(FUNDING_RATE_HIGH);

        Instant nextFundingTime = context.nextFundingTime();
        if (nextFundingTime != null && now != null) {
            Duration untilFunding = Duration.between(now, nextFundingTime);
            if (!untilFunding.isNegative() && untilFunding.compareTo(signalProperties.fundingWarnWindow()) <= 0) {
                warnings.add(FUNDING_SOON_HIGH_RATE);
            }
        }
        return warnings;
    }
}
