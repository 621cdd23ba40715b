package org.nowstart.beacon.service.strategy;

import org.nowstart.beacon.data.type.TrendClass;
import org.nowstart.beacon.service.strategy.core.MomentumProfile;
import org.springframework.stereotype.Service;

@Service
public class ConfidenceScorerService {

    static final int BASE_CONFIDENCE = 50;

    public int score(TrendClass trend, MomentumProfile momentum, double volatilityProxy) {
        int confidence = BASE_CONFIDENCE;

        confidence += isAligned(trend, momentum) ? 10 : -8;

        switch (momentum.strength()) {
            case STRONG -> confidence += 15;
            case MED -> confidence += 8;
            default -> confidence -= 5;
        }

        double volatility = Double.isFinite(volatilityProxy) ? Math.abs(volatilityProxy) : 0.0;
        if (volatility > 5.0) {
            confidence += 8;
        } else if (volatility > 2.0) {
            confidence += 4;
        } else {
            confidence -= 3;
        }

        return clamp(confidence);
    }

    public boolean isAligned(TrendClass trend, MomentumProfile momentum) {
        return switch (trend) {
            case UP -> momentum.score() > 0;
            case DOWN -> momentum.score() < 0;
            case SIDE -> Math.abs(momentum.score()) >= 2;
        };
    }

    public static int clamp(int confidence) {
        return Math.max(0, Math.min(100, confidence));
    }
}
