package org.nowstart.beacon.service;

import feign.FeignException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.beacon.data.dto.CoinApiSymbolResponse;
import org.nowstart.beacon.data.dto.InstrumentMeta;
import org.nowstart.beacon.data.property.MarketDataProperties;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.repository.CoinApiFeignClient;
import org.nowstart.beacon.repository.SignalStateStore;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class InstrumentMetadataService {

    private static final int MAX_PRECISION = 18;
    private static final int DEFAULT_SIZE_PRECISION = 4;

    private final CoinApiFeignClient coinApiFeignClient;
    private final SignalMarketDataService signalMarketDataService;
    private final SignalStateStore signalStateStore;
    private final MarketDataProperties marketDataProperties;
    private final SignalProperties signalProperties;

    public static String metaKey(String symbol) {
        return "coinapi:meta:" + symbol;
    }

    public int pricePrecision(String symbol) {
        return resolve(symbol).pricePrecision();
    }

    public InstrumentMeta resolve(String symbol) {
        Optional<InstrumentMeta> cached = signalStateStore.get(metaKey(symbol), InstrumentMeta.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        String symbolId = signalMarketDataService.coinApiSymbolId(symbol);
        List<CoinApiSymbolResponse> rows;
        try {
            rows = coinApiFeignClient.getActiveSymbols(marketDataProperties.coinapiExchangeId(), symbolId);
        } catch (FeignException e) {
            log.warn("Failed to fetch instrument metadata, using default precision. symbol={}, status={}", symbol, e.status());
            return new InstrumentMeta(symbolId, signalProperties.defaultPricePrecision(), DEFAULT_SIZE_PRECISION);
        }

        CoinApiSymbolResponse row = rows == null ? null : rows.stream()
                .filter(candidate -> candidate != null && symbolId.equals(candidate.symbol_id()))
                .findFirst()
                .orElse(null);

        InstrumentMeta meta = new InstrumentMeta(
                symbolId,
                toDecimals(row == null ? null : row.price_precision(), signalProperties.defaultPricePrecision()),
                toDecimals(row == null ? null : row.size_precision(), DEFAULT_SIZE_PRECISION)
        );
        signalStateStore.set(metaKey(symbol), meta, signalProperties.metaTtl());
        return meta;
    }

    /**
     * Accepts either a decimal count ({@code 2}) or a tick size ({@code 0.01}).
     */
    int toDecimals(BigDecimal precision, int fallback) {
        if (precision == null || precision.signum() <= 0) {
            return fallback;
        }
        if (precision.compareTo(BigDecimal.ONE) < 0) {
            return Math.min(MAX_PRECISION, precision.stripTrailingZeros().scale());
        }
        return Math.min(MAX_PRECISION, precision.intValue());
    }
}
