package org.nowstart.beacon.service.strategy;

import java.time.Instant;
import org.nowstart.beacon.data.type.BollingerWidthClass;
import org.nowstart.beacon.service.strategy.core.BollingerValue;
import org.nowstart.beacon.service.strategy.core.CandleSeries;
import org.nowstart.beacon.service.strategy.core.IndicatorSnapshot;
import org.nowstart.beacon.service.strategy.core.MacdValue;
import org.springframework.stereotype.Service;

@Service
public class SignalIndicatorService {

    public static final int RSI_PERIOD = 14;
    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int BB_PERIOD = 20;
    public static final double BB_STD_DEV = 2.0;
    public static final int VOLUME_LOOKBACK = 20;

    /**
     * Shortest series for which every indicator has a value.
     */
    public static final int MIN_COMPLETE_CANDLES = MACD_SLOW + MACD_SIGNAL - 1;

    private static final double BB_WIDTH_HIGH = 0.04;
    private static final double BB_WIDTH_LOW = 0.02;

    public IndicatorSnapshot snapshot(CandleSeries series, int atrPeriod) {
        if (series == null || series.isEmpty()) {
            return new IndicatorSnapshot(null, null, null, null, 1.0, BollingerWidthClass.MID, 0, Double.NaN, null);
        }

        double[] close = series.closes();
        double[] high = series.highs();
        double[] low = series.lows();
        double[] volume = series.volumes();
        int last = close.length - 1;

        Double rsi = lastFinite(relativeStrengthIndex(close, RSI_PERIOD));
        MacdValue macd = lastMacd(close);
        BollingerValue bollinger = lastBollinger(close);
        Double atr = lastFinite(wilderAtr(high, low, close, atrPeriod));

        BollingerWidthClass widthClass = BollingerWidthClass.MID;
        int position = 0;
        if (bollinger != null && bollinger.middle() != 0.0) {
            widthClass = resolveWidthClass(bollinger);
            if (close[last] > bollinger.middle()) {
                position = 1;
            } else if (close[last] < bollinger.middle()) {
                position = -1;
            }
        }

        Instant lastCloseTime = series.last().closeTime();
        return new IndicatorSnapshot(
                rsi,
                macd,
                bollinger,
                atr,
                volumeRatio(volume),
                widthClass,
                position,
                close[last],
                lastCloseTime
        );
    }

    public double[] exponentialMovingAverage(double[] values, int length) {
        int n = values.length;
        double[] ema = fillNaN(n);
        if (length <= 0 || n < length) {
            return ema;
        }

        double seed = 0.0;
        for (int i = 0; i < length; i++) {
            seed += values[i];
        }
        ema[length - 1] = seed / length;

        double alpha = 2.0 / (length + 1.0);
        for (int i = length; i < n; i++) {
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    public double[] relativeStrengthIndex(double[] close, int period) {
        int n = close.length;
        double[] rsi = fillNaN(n);
        if (period <= 0 || n <= period) {
            return rsi;
        }

        double gainSum = 0.0;
        double lossSum = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = close[i] - close[i - 1];
            if (change > 0) {
                gainSum += change;
            } else {
                lossSum -= change;
            }
        }

        double avgGain = gainSum / period;
        double avgLoss = lossSum / period;
        rsi[period] = toRsi(avgGain, avgLoss);

        for (int i = period + 1; i < n; i++) {
            double change = close[i] - close[i - 1];
            double gain = Math.max(change, 0.0);
            double loss = Math.max(-change, 0.0);
            avgGain = ((avgGain * (period - 1)) + gain) / period;
            avgLoss = ((avgLoss * (period - 1)) + loss) / period;
            rsi[i] = toRsi(avgGain, avgLoss);
        }
        return rsi;
    }

    public double[][] macd(double[] close, int fastPeriod, int slowPeriod, int signalPeriod) {
        int n = close.length;
        double[] fast = exponentialMovingAverage(close, fastPeriod);
        double[] slow = exponentialMovingAverage(close, slowPeriod);
        double[] line = fillNaN(n);
        double[] signal = fillNaN(n);
        double[] histogram = fillNaN(n);

        int start = Math.max(fastPeriod, slowPeriod) - 1;
        if (start < 0 || n <= start) {
            return new double[][] {line, signal, histogram};
        }

        for (int i = start; i < n; i++) {
            line[i] = fast[i] - slow[i];
        }

        double[] tail = new double[n - start];
        System.arraycopy(line, start, tail, 0, tail.length);
        double[] tailSignal = exponentialMovingAverage(tail, signalPeriod);
        for (int i = 0; i < tail.length; i++) {
            signal[start + i] = tailSignal[i];
            if (Double.isFinite(tailSignal[i])) {
                histogram[start + i] = line[start + i] - tailSignal[i];
            }
        }
        return new double[][] {line, signal, histogram};
    }

    public double[][] bollingerBands(double[] close, int period, double stdDev) {
        int n = close.length;
        double[] upper = fillNaN(n);
        double[] middle = fillNaN(n);
        double[] lower = fillNaN(n);
        if (period <= 0 || n < period) {
            return new double[][] {upper, middle, lower};
        }

        for (int i = period - 1; i < n; i++) {
            double sum = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                sum += close[j];
            }
            double mean = sum / period;

            double squared = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double diff = close[j] - mean;
                squared += diff * diff;
            }
            double deviation = Math.sqrt(squared / period);

            middle[i] = mean;
            upper[i] = mean + (stdDev * deviation);
            lower[i] = mean - (stdDev * deviation);
        }
        return new double[][] {upper, middle, lower};
    }

    public double[] wilderAtr(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] atr = fillNaN(n);
        if (period <= 0 || n < period) {
            return atr;
        }

        double[] tr = new double[n];
        tr[0] = high[0] - low[0];
        for (int i = 1; i < n; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            tr[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }

        double total = 0.0;
        for (int i = 0; i < period; i++) {
            total += tr[i];
        }

        int first = period - 1;
        atr[first] = total / period;
        for (int i = period; i < n; i++) {
            atr[i] = ((atr[i - 1] * (period - 1)) + tr[i]) / period;
        }
        return atr;
    }

    public double volumeRatio(double[] volume) {
        if (volume.length == 0) {
            return 1.0;
        }

        int window = Math.min(VOLUME_LOOKBACK, volume.length);
        double sum = 0.0;
        for (int i = volume.length - window; i < volume.length; i++) {
            sum += volume[i];
        }
        double average = sum / window;
        return average > 0.0 ? volume[volume.length - 1] / average : 1.0;
    }

    public BollingerWidthClass resolveWidthClass(BollingerValue bollinger) {
        double width = (bollinger.upper() - bollinger.lower()) / bollinger.middle();
        if (width >= BB_WIDTH_HIGH) {
            return BollingerWidthClass.HIGH;
        }
        if (width <= BB_WIDTH_LOW) {
            return BollingerWidthClass.LOW;
        }
        return BollingerWidthClass.MID;
    }

    private MacdValue lastMacd(double[] close) {
        double[][] macd = macd(close, MACD_FAST, MACD_SLOW, MACD_SIGNAL);
        int last = close.length - 1;
        if (!Double.isFinite(macd[2][last])) {
            return null;
        }
        return new MacdValue(macd[0][last], macd[1][last], macd[2][last]);
    }

    private BollingerValue lastBollinger(double[] close) {
        double[][] bands = bollingerBands(close, BB_PERIOD, BB_STD_DEV);
        int last = close.length - 1;
        if (!Double.isFinite(bands[1][last])) {
            return null;
        }
        return new BollingerValue(bands[0][last], bands[1][last], bands[2][last]);
    }

    private double toRsi(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    private Double lastFinite(double[] values) {
        if (values.length == 0) {
            return null;
        }
        double value = values[values.length - 1];
        return Double.isFinite(value) ? value : null;
    }

    private double[] fillNaN(int size) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = Double.NaN;
        }
        return values;
    }
}
