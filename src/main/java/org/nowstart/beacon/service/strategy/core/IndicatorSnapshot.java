package org.nowstart.beacon.service.strategy.core;

import java.time.Instant;
import org.nowstart.beacon.data.type.BollingerWidthClass;

/**
 * Last computed value of every indicator over a candle series.
 *
 * <p>{@code rsi}, {@code macd}, {@code bollinger} and {@code atr} are {@code null} when the series is shorter
 * than the indicator window. Any {@code null} means the evaluation must be abandoned for this cycle.
 */
public record IndicatorSnapshot(
        Double rsi,
        MacdValue macd,
        BollingerValue bollinger,
        Double atr,
        double volumeRatio,
        BollingerWidthClass bbWidthClass,
        int bbPosition,
        double lastClose,
        Instant lastCandleCloseTime
) {

    public boolean isComplete() {
        return rsi != null && macd != null && bollinger != null && atr != null;
    }

    public double macdHistogram() {
        return macd == null ? 0.0 : macd.histogram();
    }
}
