package org.nowstart.beacon.service.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.beacon.data.type.BollingerWidthClass;
import org.nowstart.beacon.service.strategy.core.BollingerValue;
import org.nowstart.beacon.service.strategy.core.CandleSeries;
import org.nowstart.beacon.service.strategy.core.IndicatorSnapshot;
import org.nowstart.beacon.support.SignalFixtures;

class SignalIndicatorServiceTest {

    private final SignalIndicatorService service = new SignalIndicatorService();

    @Test
    void snapshot_isCompleteOnceMacdSignalHasWarmedUp() {
        IndicatorSnapshot snapshot = service.snapshot(
                SignalFixtures.linearSeries(SignalIndicatorService.MIN_COMPLETE_CANDLES, 100.0, 1.0),
                14
        );

        assertThat(snapshot.isComplete()).isTrue();
        assertThat(snapshot.lastCandleCloseTime()).isEqualTo(SignalFixtures.CANDLE_CLOSE);
    }

    @Test
    void snapshot_leavesMacdEmptyOneCandleShortOfWarmUp() {
        IndicatorSnapshot snapshot = service.snapshot(
                SignalFixtures.linearSeries(SignalIndicatorService.MIN_COMPLETE_CANDLES - 1, 100.0, 1.0),
                14
        );

        assertThat(snapshot.macd()).isNull();
        assertThat(snapshot.rsi()).isNotNull();
        assertThat(snapshot.bollinger()).isNotNull();
        assertThat(snapshot.atr()).isNotNull();
        assertThat(snapshot.isComplete()).isFalse();
    }

    @Test
    void snapshot_returnsNeutralValuesForEmptySeries() {
        IndicatorSnapshot snapshot = service.snapshot(new CandleSeries("X", List.of()), 14);

        assertThat(snapshot.isComplete()).isFalse();
        assertThat(snapshot.volumeRatio()).isEqualTo(1.0);
        assertThat(snapshot.bbWidthClass()).isEqualTo(BollingerWidthClass.MID);
        assertThat(snapshot.bbPosition()).isZero();
        assertThat(snapshot.lastCandleCloseTime()).isNull();
    }

    @Test
    void snapshot_risingSeriesHasMaxRsiAndClosesAboveMiddleBand() {
        IndicatorSnapshot snapshot = service.snapshot(SignalFixtures.linearSeries(60, 100.0, 1.0), 14);

        assertThat(snapshot.rsi()).isEqualTo(100.0);
        assertThat(snapshot.bbPosition()).isEqualTo(1);
        assertThat(snapshot.atr()).isCloseTo(2.0, within(1e-9));
        assertThat(snapshot.lastClose()).isEqualTo(159.0);
    }

    @Test
    void relativeStrengthIndex_flatSeriesIsNeutral() {
        double[] close = new double[20];
        Arrays.fill(close, 50.0);

        double[] rsi = service.relativeStrengthIndex(close, 14);

        assertThat(rsi[13]).isNaN();
        assertThat(rsi[14]).isEqualTo(50.0);
        assertThat(rsi[19]).isEqualTo(50.0);
    }

    @Test
    void relativeStrengthIndex_usesWilderSmoothing() {
        double[] close = {10.0, 11.0, 10.0, 12.0};

        double[] rsi = service.relativeStrengthIndex(close, 2);

        // seed: avgGain 0.5, avgLoss 0.5 -> 50; next: avgGain 1.25, avgLoss 0.25 -> rs 5
        assertThat(rsi[2]).isCloseTo(50.0, within(1e-9));
        assertThat(rsi[3]).isCloseTo(100.0 - (100.0 / 6.0), within(1e-9));
    }

    @Test
    void exponentialMovingAverage_seedsWithSimpleAverage() {
        double[] ema = service.exponentialMovingAverage(new double[] {1.0, 2.0, 3.0, 4.0}, 2);

        assertThat(ema[0]).isNaN();
        assertThat(ema[1]).isCloseTo(1.5, within(1e-9));
        assertThat(ema[2]).isCloseTo(2.5, within(1e-9));
        assertThat(ema[3]).isCloseTo(3.5, within(1e-9));
    }

    @Test
    void bollingerBands_usePopulationStandardDeviation() {
        double[][] bands = service.bollingerBands(new double[] {1.0, 2.0, 3.0, 4.0, 5.0}, 5, 2.0);

        assertThat(bands[1][4]).isCloseTo(3.0, within(1e-9));
        assertThat(bands[0][4]).isCloseTo(3.0 + (2.0 * Math.sqrt(2.0)), within(1e-9));
        assertThat(bands[2][4]).isCloseTo(3.0 - (2.0 * Math.sqrt(2.0)), within(1e-9));
        assertThat(bands[1][3]).isNaN();
    }

    @Test
    void wilderAtr_includesGapsAgainstPreviousClose() {
        double[] high = {11.0, 12.0, 16.0};
        double[] low = {9.0, 10.0, 14.0};
        double[] close = {10.0, 11.0, 15.0};

        double[] atr = service.wilderAtr(high, low, close, 2);

        // tr = [2, 2, 5]; seed (2+2)/2 = 2; next (2*1+5)/2 = 3.5
        assertThat(atr[0]).isNaN();
        assertThat(atr[1]).isCloseTo(2.0, within(1e-9));
        assertThat(atr[2]).isCloseTo(3.5, within(1e-9));
    }

    @Test
    void macd_histogramIsLineMinusSignal() {
        double[] close = SignalFixtures.linearSeries(50, 100.0, 0.5).closes();

        double[][] macd = service.macd(close, 12, 26, 9);

        int last = close.length - 1;
        assertThat(macd[2][32]).isNaN();
        assertThat(macd[2][33]).isFinite();
        assertThat(macd[2][last]).isCloseTo(macd[0][last] - macd[1][last], within(1e-12));
    }

    @Test
    void volumeRatio_comparesLastVolumeToAvailableWindow() {
        assertThat(service.volumeRatio(new double[] {1.0, 1.0, 4.0})).isCloseTo(2.0, within(1e-9));
        assertThat(service.volumeRatio(new double[] {0.0, 0.0})).isEqualTo(1.0);
        assertThat(service.volumeRatio(new double[0])).isEqualTo(1.0);
    }

    @Test
    void resolveWidthClass_bucketsRelativeBandWidth() {
        assertThat(service.resolveWidthClass(new BollingerValue(106.0, 103.0, 100.0))).isEqualTo(BollingerWidthClass.HIGH);
        assertThat(service.resolveWidthClass(new BollingerValue(104.0, 102.0, 100.0))).isEqualTo(BollingerWidthClass.MID);
        assertThat(service.resolveWidthClass(new BollingerValue(101.0, 100.5, 100.0))).isEqualTo(BollingerWidthClass.LOW);
    }
}
