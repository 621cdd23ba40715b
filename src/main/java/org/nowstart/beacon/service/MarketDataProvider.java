package org.nowstart.beacon.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.nowstart.beacon.service.strategy.core.CandleSeries;
import org.nowstart.beacon.service.strategy.core.MarketContext;

/**
 * Source of candles and market context for watch-list symbols.
 *
 * <p>A missing or short series is reported as {@link Optional#empty()}. Transport failures propagate as exceptions
 * and are contained per symbol by the caller.
 */
public interface MarketDataProvider {

    Optional<CandleSeries> fetchCandles(String symbol, String periodSpec, int limit);

    // 모르는 심볼은 맵에서 빠진다
    Map<String, MarketContext> fetchContexts(List<String> symbols);

    default Optional<MarketContext> fetchContext(String symbol) {
        return Optional.ofNullable(fetchContexts(List.of(symbol)).get(symbol));
    }
}
