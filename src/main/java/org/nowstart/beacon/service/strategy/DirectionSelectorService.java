package org.nowstart.beacon.service.strategy;

import org.nowstart.beacon.data.type.TradeDirection;
import org.nowstart.beacon.data.type.TrendClass;
import org.nowstart.beacon.service.strategy.core.DirectionCandidate;
import org.nowstart.beacon.service.strategy.core.IndicatorSnapshot;
import org.springframework.stereotype.Service;

@Service
public class DirectionSelectorService {

    public static final String RSI_OVERBOUGHT_IN_UPTREND = "RSI_OVERBOUGHT_IN_UPTREND";
    public static final String UPTREND_RSI_OK = "UPTREND_RSI_OK";
    public static final String RSI_OVERSOLD_IN_DOWNTREND = "RSI_OVERSOLD_IN_DOWNTREND";
    public static final String DOWNTREND_RSI_OK = "DOWNTREND_RSI_OK";
    public static final String SIDE_BULL_BIAS = "SIDE_BULL_BIAS";
    public static final String SIDE_BEAR_BIAS = "SIDE_BEAR_BIAS";
    public static final String SIDE_NO_EDGE = "SIDE_NO_EDGE";

    static final double RSI_OVERBOUGHT = 70.0;
    static final double RSI_OVERSOLD = 30.0;
    private static final double SIDE_LONG_RSI = 55.0;
    private static final double SIDE_SHORT_RSI = 45.0;

    public DirectionCandidate directionCandidate(TrendClass trend, IndicatorSnapshot indicators) {
        Double rsi = indicators.rsi();

        if (trend == TrendClass.UP) {
            if (rsi != null && rsi >= RSI_OVERBOUGHT) {
                return DirectionCandidate.reversal(TradeDirection.SHORT, RSI_OVERBOUGHT_IN_UPTREND);
            }
            return DirectionCandidate.trend(TradeDirection.LONG, UPTREND_RSI_OK);
        }
        if (trend == TrendClass.DOWN) {
            if (rsi != null && rsi <= RSI_OVERSOLD) {
                return DirectionCandidate.reversal(TradeDirection.LONG, RSI_OVERSOLD_IN_DOWNTREND);
            }
            return DirectionCandidate.trend(TradeDirection.SHORT, DOWNTREND_RSI_OK);
        }

        if (rsi != null && indicators.macd() != null) {
            double histogram = indicators.macdHistogram();
            if (rsi > SIDE_LONG_RSI && histogram > 0) {
                return DirectionCandidate.trend(TradeDirection.LONG, SIDE_BULL_BIAS);
            }
            if (rsi < SIDE_SHORT_RSI && histogram < 0) {
                return DirectionCandidate.trend(TradeDirection.SHORT, SIDE_BEAR_BIAS);
            }
        }
        return DirectionCandidate.noTrade(SIDE_NO_EDGE);
    }

    /**
     * A reversal held at close when RSI has left the extreme zone or momentum moved since the preview.
     */
    public boolean isReversalConfirmed(TradeDirection direction, double rsi, int momentumScore, int previewMomentumScore) {
        if (direction == TradeDirection.SHORT && rsi < RSI_OVERBOUGHT) {
            return true;
        }
        if (direction == TradeDirection.LONG && rsi > RSI_OVERSOLD) {
            return true;
        }
        return momentumScore != previewMomentumScore;
    }
}
