package org.nowstart.beacon.service.strategy;

import lombok.RequiredArgsConstructor;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.data.type.BollingerWidthClass;
import org.nowstart.beacon.data.type.MomentumStrength;
import org.nowstart.beacon.data.type.TrendClass;
import org.nowstart.beacon.service.strategy.core.IndicatorSnapshot;
import org.nowstart.beacon.service.strategy.core.MomentumProfile;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Service
@RefreshScope
@RequiredArgsConstructor
public class MarketClassifierService {

    private static final int TREND_SCORE_THRESHOLD = 2;
    private static final int STRONG_MOMENTUM = 4;
    private static final int MED_MOMENTUM = 2;

    private final SignalProperties signalProperties;

    /**
     * 24h 등락률 기본 점수(+-2)에 MACD 히스토그램 부호와 볼린저 위치를 더해 추세를 분류한다.
     */
    public TrendClass classifyTrend(double percentChange24h, IndicatorSnapshot indicators) {
        int score = 0;
        if (percentChange24h > signalProperties.trendUpPct()) {
            score += 2;
        } else if (percentChange24h < signalProperties.trendDownPct()) {
            score -= 2;
        }

        if (indicators.macd() != null) {
            score += (int) Math.signum(indicators.macdHistogram());
        }
        score += indicators.bbPosition();

        if (score >= TREND_SCORE_THRESHOLD) {
            return TrendClass.UP;
        }
        if (score <= -TREND_SCORE_THRESHOLD) {
            return TrendClass.DOWN;
        }
        return TrendClass.SIDE;
    }

    public MomentumProfile computeMomentum(IndicatorSnapshot indicators) {
        int score = 0;

        Double rsi = indicators.rsi();
        if (rsi != null) {
            if (rsi >= 60) {
                score += 2;
            } else if (rsi >= 52) {
                score += 1;
            } else if (rsi <= 40) {
                score -= 2;
            } else if (rsi <= 48) {
                score -= 1;
            }
        }

        double volumeRatio = indicators.volumeRatio();
        if (volumeRatio >= 1.5) {
            score += 2;
        } else if (volumeRatio >= 1.1) {
            score += 1;
        } else if (volumeRatio <= 0.7) {
            score -= 1;
        }

        if (indicators.bbWidthClass() == BollingerWidthClass.HIGH) {
            score += 1;
        } else if (indicators.bbWidthClass() == BollingerWidthClass.LOW) {
            score -= 1;
        }

        return new MomentumProfile(score, resolveStrength(score));
    }

    private MomentumStrength resolveStrength(int score) {
        int magnitude = Math.abs(score);
        if (magnitude >= STRONG_MOMENTUM) {
            return MomentumStrength.STRONG;
        }
        if (magnitude >= MED_MOMENTUM) {
            return MomentumStrength.MED;
        }
        return MomentumStrength.WEAK;
    }
}
