package org.nowstart.beacon.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.beacon.data.dto.CoinApiOhlcvResponse;
import org.nowstart.beacon.data.dto.CoinGeckoDerivativeResponse;
import org.nowstart.beacon.data.property.MarketDataProperties;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.repository.CoinApiFeignClient;
import org.nowstart.beacon.repository.CoinGeckoFeignClient;
import org.nowstart.beacon.service.strategy.core.CandleSeries;
import org.nowstart.beacon.service.strategy.core.MarketContext;
import org.nowstart.beacon.service.strategy.core.OhlcvCandle;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class SignalMarketDataService implements MarketDataProvider {

    static final List<String> QUOTE_ASSETS = List.of("USDT", "USDC", "BUSD", "FDUSD", "TUSD");
    private static final int FALLBACK_QUOTE_LENGTH = 4;

    private final CoinApiFeignClient coinApiFeignClient;
    private final CoinGeckoFeignClient coinGeckoFeignClient;
    private final MarketDataProperties marketDataProperties;
    private final SignalProperties signalProperties;
    private final Clock clock;

    @Override
    public Optional<CandleSeries> fetchCandles(String symbol, String periodSpec, int limit) {
        String symbolId = coinApiSymbolId(symbol);
        int minimum = signalProperties.atrPeriod() + 2;

        List<CoinApiOhlcvResponse> rows = coinApiFeignClient.getOhlcvHistory(symbolId, periodSpec, limit);
        if (rows == null || rows.size() < minimum) {
            log.warn(
                    "Not enough candles received from provider. symbol={}, symbolId={}, received={}, required={}",
                    symbol,
                    symbolId,
                    rows == null ? 0 : rows.size(),
                    minimum
            );
            return Optional.empty();
        }

        List<OhlcvCandle> candles = rows.stream()
                .map(this::toCandle)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(OhlcvCandle::openTime))
                .toList();
        if (candles.size() < minimum) {
            log.warn(
                    "Not enough valid candles after normalization. symbol={}, rawCount={}, validCount={}",
                    symbol,
                    rows.size(),
                    candles.size()
            );
            return Optional.empty();
        }

        return Optional.of(new CandleSeries(symbolId, candles));
    }

    @Override
    public Map<String, MarketContext> fetchContexts(List<String> symbols) {
        List<CoinGeckoDerivativeResponse> rows = coinGeckoFeignClient.getDerivatives();
        if (rows == null || rows.isEmpty()) {
            log.warn("No derivatives received from provider. symbolCount={}", symbols.size());
            return Map.of();
        }

        Map<String, CoinGeckoDerivativeResponse> bestByKey = new LinkedHashMap<>();
        String marketFilter = marketDataProperties.coingeckoMarketFilter();
        for (CoinGeckoDerivativeResponse row : rows) {
            if (row == null) {
                continue;
            }
            if (marketFilter != null && !marketFilter.isBlank() && !marketFilter.equals(row.market())) {
                continue;
            }
            String key = normalizeDerivativeSymbol(row.symbol());
            CoinGeckoDerivativeResponse previous = bestByKey.get(key);
            if (previous == null || rowScore(row) > rowScore(previous)) {
                bestByKey.put(key, row);
            }
        }

        Map<String, MarketContext> contexts = new LinkedHashMap<>();
        for (String symbol : symbols) {
            CoinGeckoDerivativeResponse row = bestByKey.get(normalizeDerivativeSymbol(symbol));
            if (row != null) {
                contexts.put(symbol, toMarketContext(row));
            }
        }
        return contexts;
    }

    public String coinApiSymbolId(String symbol) {
        String normalized = normalizeSymbol(symbol);
        String exchangeId = marketDataProperties.coinapiExchangeId();
        for (String quote : QUOTE_ASSETS) {
            if (normalized.endsWith(quote) && normalized.length() > quote.length()) {
                String base = normalized.substring(0, normalized.length() - quote.length());
                return exchangeId + "_PERP_" + base + "_" + quote;
            }
        }

        int split = Math.max(0, normalized.length() - FALLBACK_QUOTE_LENGTH);
        return exchangeId + "_PERP_" + normalized.substring(0, split) + "_" + normalized.substring(split);
    }

    public String normalizeSymbol(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }

    String normalizeDerivativeSymbol(String value) {
        return normalizeSymbol(value)
                .replaceAll("[^A-Z0-9]", "")
                .replace("PERP", "");
    }

    int rowScore(CoinGeckoDerivativeResponse row) {
        int score = 0;
        if ("perpetual".equalsIgnoreCase(row.contract_type())) {
            score += 10;
        }
        if (row.index() != null) {
            score += 2;
        }
        if (row.funding_rate() != null) {
            score += 2;
        }
        if (row.open_interest() != null) {
            score += 1;
        }
        return score;
    }

    private MarketContext toMarketContext(CoinGeckoDerivativeResponse row) {
        BigDecimal entry = row.index() != null ? row.index() : row.price();
        return new MarketContext(
                row.market(),
                row.price_percentage_change_24h() == null ? 0.0 : row.price_percentage_change_24h().doubleValue(),
                null,
                entry == null ? null : entry.doubleValue(),
                row.funding_rate() == null ? null : row.funding_rate().doubleValue(),
                null
        );
    }

    private OhlcvCandle toCandle(CoinApiOhlcvResponse row) {
        if (row == null
                || row.time_period_start() == null
                || row.price_open() == null
                || row.price_high() == null
                || row.price_low() == null
                || row.price_close() == null) {
            return null;
        }

        try {
            Instant openTime = Instant.parse(row.time_period_start());
            return new OhlcvCandle(
                    openTime,
                    resolveCloseTime(row),
                    row.price_open().doubleValue(),
                    row.price_high().doubleValue(),
                    row.price_low().doubleValue(),
                    row.price_close().doubleValue(),
                    row.volume_traded() == null ? 0.0 : row.volume_traded().doubleValue()
            );
        } catch (DateTimeParseException e) {
            log.warn("Failed to parse candle row. row={}", row, e);
            return null;
        }
    }

    private Instant resolveCloseTime(CoinApiOhlcvResponse row) {
        for (String candidate : new String[] {row.time_period_end(), row.time_close(), row.time_period_start()}) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            try {
                return Instant.parse(candidate);
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unparsable candle close time. value={}", candidate);
            }
        }
        return clock.instant();
    }
}
