package org.nowstart.beacon.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import feign.FeignException;
import feign.Request;
import feign.Response;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.beacon.data.dto.CoinApiSymbolResponse;
import org.nowstart.beacon.data.dto.InstrumentMeta;
import org.nowstart.beacon.repository.CoinApiFeignClient;
import org.nowstart.beacon.repository.CoinGeckoFeignClient;
import org.nowstart.beacon.repository.InMemorySignalStateStore;
import org.nowstart.beacon.support.MutableClock;
import org.nowstart.beacon.support.SignalFixtures;

@ExtendWith(MockitoExtension.class)
class InstrumentMetadataServiceTest {

    @Mock
    private CoinApiFeignClient coinApiFeignClient;

    @Mock
    private CoinGeckoFeignClient coinGeckoFeignClient;

    private MutableClock clock;
    private InMemorySignalStateStore store;
    private InstrumentMetadataService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        store = new InMemorySignalStateStore(clock);
        SignalMarketDataService marketDataService = new SignalMarketDataService(
                coinApiFeignClient,
                coinGeckoFeignClient,
                SignalFixtures.marketDataProperties(""),
                SignalFixtures.signalProperties(),
                clock
        );
        service = new InstrumentMetadataService(
                coinApiFeignClient,
                marketDataService,
                store,
                SignalFixtures.marketDataProperties(""),
                SignalFixtures.signalProperties()
        );
    }

    @Test
    void resolve_readsTickSizeAndCachesForMetaTtl() {
        when(coinApiFeignClient.getActiveSymbols("BINANCE", "BINANCE_PERP_BTC_USDT")).thenReturn(List.of(
                symbol("BINANCE_PERP_BTC_USDT", "0.1", "0.001")
        ));

        InstrumentMeta first = service.resolve("BTCUSDT");
        InstrumentMeta second = service.resolve("BTCUSDT");

        assertThat(first).isEqualTo(new InstrumentMeta("BINANCE_PERP_BTC_USDT", 1, 3));
        assertThat(second).isEqualTo(first);
        verify(coinApiFeignClient, times(1)).getActiveSymbols(anyString(), anyString());

        clock.advance(Duration.ofHours(24));
        service.resolve("BTCUSDT");
        verify(coinApiFeignClient, times(2)).getActiveSymbols(anyString(), anyString());
    }

    @Test
    void resolve_fallsBackToDefaultsWhenSymbolIsUnknown() {
        when(coinApiFeignClient.getActiveSymbols("BINANCE", "BINANCE_PERP_ETH_USDT")).thenReturn(List.of(
                symbol("BINANCE_PERP_ETH_USDC", "0.01", "0.001")
        ));

        InstrumentMeta meta = service.resolve("ETHUSDT");

        assertThat(meta.pricePrecision()).isEqualTo(2);
        assertThat(meta.sizePrecision()).isEqualTo(4);
    }

    @Test
    void pricePrecision_usesDefaultWithoutCachingWhenProviderFails() {
        when(coinApiFeignClient.getActiveSymbols("BINANCE", "BINANCE_PERP_BTC_USDT")).thenThrow(unavailable());

        int precision = service.pricePrecision("BTCUSDT");

        assertThat(precision).isEqualTo(2);
        assertThat(store.get(InstrumentMetadataService.metaKey("BTCUSDT"), InstrumentMeta.class)).isEmpty();
    }

    @Test
    void resolve_servesCachedValueWithoutCallingProvider() {
        store.set(
                InstrumentMetadataService.metaKey("BTCUSDT"),
                new InstrumentMeta("BINANCE_PERP_BTC_USDT", 4, 2),
                Duration.ofHours(1)
        );

        assertThat(service.pricePrecision("BTCUSDT")).isEqualTo(4);
        verify(coinApiFeignClient, never()).getActiveSymbols(anyString(), anyString());
    }

    @Test
    void toDecimals_acceptsDecimalCountsAndTickSizes() {
        assertThat(service.toDecimals(new BigDecimal("0.01"), 8)).isEqualTo(2);
        assertThat(service.toDecimals(new BigDecimal("0.00010"), 8)).isEqualTo(4);
        assertThat(service.toDecimals(new BigDecimal("3"), 8)).isEqualTo(3);
        assertThat(service.toDecimals(new BigDecimal("1"), 8)).isEqualTo(1);
        assertThat(service.toDecimals(new BigDecimal("40"), 8)).isEqualTo(18);
        assertThat(service.toDecimals(BigDecimal.ZERO, 8)).isEqualTo(8);
        assertThat(service.toDecimals(null, 8)).isEqualTo(8);
    }

    private CoinApiSymbolResponse symbol(String symbolId, String pricePrecision, String sizePrecision) {
        return new CoinApiSymbolResponse(
                symbolId,
                "BINANCE",
                "PERPETUAL",
                "BTC",
                "USDT",
                new BigDecimal(pricePrecision),
                new BigDecimal(sizePrecision)
        );
    }

    private FeignException unavailable() {
        Request request = Request.create(
                Request.HttpMethod.GET,
                "/v1/symbols/BINANCE/active",
                Map.of(),
                null,
                StandardCharsets.UTF_8,
                null
        );
        Response response = Response.builder()
                .status(503)
                .reason("Service Unavailable")
                .request(request)
                .headers(Map.of())
                .body("{\"error\":\"unavailable\"}", StandardCharsets.UTF_8)
                .build();
        return FeignException.errorStatus("CoinApiFeignClient#getActiveSymbols", response);
    }
}
