package org.nowstart.beacon.service.strategy.core;

import java.util.List;

public record CandleSeries(
        String providerSymbolId,
        List<OhlcvCandle> candles
) {

    public CandleSeries {
        candles = candles == null ? List.of() : List.copyOf(candles);
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public OhlcvCandle last() {
        return candles.get(candles.size() - 1);
    }

    public double[] closes() {
        return candles.stream().mapToDouble(OhlcvCandle::close).toArray();
    }

    public double[] highs() {
        return candles.stream().mapToDouble(OhlcvCandle::high).toArray();
    }

    public double[] lows() {
        return candles.stream().mapToDouble(OhlcvCandle::low).toArray();
    }

    public double[] volumes() {
        return candles.stream().mapToDouble(OhlcvCandle::volume).toArray();
    }
}
