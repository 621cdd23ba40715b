package org.nowstart.beacon.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.beacon.data.dto.ConfirmationResult;
import org.nowstart.beacon.data.dto.PendingConfirmation;
import org.nowstart.beacon.data.dto.SignalBatchResult;
import org.nowstart.beacon.data.dto.SignalDto;
import org.nowstart.beacon.data.dto.SignalStateDto;
import org.nowstart.beacon.data.dto.SnapshotMetrics;
import org.nowstart.beacon.data.exception.SignalApiException;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.data.type.BollingerWidthClass;
import org.nowstart.beacon.data.type.EvaluationMode;
import org.nowstart.beacon.data.type.SignalMode;
import org.nowstart.beacon.data.type.TradeDirection;
import org.nowstart.beacon.repository.InMemorySignalStateStore;
import org.nowstart.beacon.service.strategy.ConfidenceScorerService;
import org.nowstart.beacon.service.strategy.DirectionSelectorService;
import org.nowstart.beacon.service.strategy.LiquidationRiskService;
import org.nowstart.beacon.service.strategy.MarketClassifierService;
import org.nowstart.beacon.service.strategy.SignalIndicatorService;
import org.nowstart.beacon.service.strategy.TargetPlannerService;
import org.nowstart.beacon.service.strategy.core.MarketContext;
import org.nowstart.beacon.support.MutableClock;
import org.nowstart.beacon.support.SignalFixtures;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class SignalBatchServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:00:30Z"), ZoneOffset.UTC);
    private static final MarketContext BTC_CONTEXT = SignalFixtures.context(3.0, 100.0);

    @Mock
    private SignalLifecycleService signalLifecycleService;

    @Mock
    private SignalStateService signalStateService;

    @Mock
    private SignalIdentityService signalIdentityService;

    @Mock
    private SignalLogService signalLogService;

    @Mock
    private MarketDataProvider marketDataProvider;

    @Test
    void evaluate_collectsSignalsAndContainsPerSymbolFailures() {
        SignalBatchService service = service(SignalFixtures.signalProperties(), Runnable::run);
        SignalDto preview = preview("BTCUSDT");
        when(marketDataProvider.fetchContexts(List.of("BTCUSDT", "ETHUSDT"))).thenReturn(Map.of("BTCUSDT", BTC_CONTEXT));
        when(signalLifecycleService.evaluateIntrabar("BTCUSDT", BTC_CONTEXT, null)).thenReturn(Optional.of(preview));
        when(signalLifecycleService.evaluateIntrabar("ETHUSDT", null, null)).thenThrow(new IllegalStateException("candles unavailable"));
        when(signalIdentityService.errorId(eq("ETHUSDT"), any())).thenReturn("err-eth");

        SignalBatchResult result = service.evaluate(EvaluationMode.INTRABAR, null);

        assertThat(result.mode()).isEqualTo(EvaluationMode.INTRABAR);
        assertThat(result.watchlist()).containsExactly("BTCUSDT", "ETHUSDT");
        assertThat(result.signals()).containsExactly(preview);
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.id()).isEqualTo("err-eth");
            assertThat(error.symbol()).isEqualTo("ETHUSDT");
            assertThat(error.error()).isEqualTo("candles unavailable");
        });
        verify(signalLogService).logBatch(result);
    }

    @Test
    void evaluate_closeModeRunsCloseEvaluationWithThreshold() {
        SignalBatchService service = service(SignalFixtures.signalProperties(), Runnable::run);
        when(marketDataProvider.fetchContexts(List.of("BTCUSDT", "ETHUSDT"))).thenReturn(Map.of());
        when(signalLifecycleService.evaluateOnClose("BTCUSDT", null, 70)).thenReturn(Optional.empty());
        when(signalLifecycleService.evaluateOnClose("ETHUSDT", null, 70)).thenReturn(Optional.empty());

        SignalBatchResult result = service.evaluate(EvaluationMode.CLOSE, 70);

        assertThat(result.signals()).isEmpty();
        assertThat(result.errors()).isEmpty();
        verify(signalLifecycleService, never()).evaluateIntrabar(any(), any(), any());
    }

    @Test
    void evaluate_returnsConfirmationCommittedBySlowSymbol() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            SignalProperties properties = SignalFixtures.signalProperties(List.of("BTCUSDT"));
            MutableClock clock = new MutableClock(Instant.parse("2026-03-02T11:00:05Z"));
            InMemorySignalStateStore store = new InMemorySignalStateStore(clock);
            SignalStateService stateService = new SignalStateService(store, properties, clock);
            SignalIdentityService identityService = new SignalIdentityService(store, properties);
            SignalLifecycleService lifecycle = realLifecycle(properties, store, stateService, identityService, clock);
            stateService.savePending("BTCUSDT", new PendingConfirmation(
                    "preview-BTCUSDT",
                    TradeDirection.LONG,
                    Instant.parse("2026-03-02T10:40:00Z"),
                    true,
                    new SnapshotMetrics(4, BollingerWidthClass.MID, 2.0, 65.0, SignalFixtures.CANDLE_CLOSE)
            ));
            when(marketDataProvider.fetchContexts(List.of("BTCUSDT"))).thenReturn(Map.of("BTCUSDT", BTC_CONTEXT));
            when(marketDataProvider.fetchCandles("BTCUSDT", "1HRS", 200)).thenAnswer(invocation -> {
                Thread.sleep(300);
                return Optional.of(SignalFixtures.singleCandleSeries());
            });
            SignalBatchService service = new SignalBatchService(
                    lifecycle,
                    stateService,
                    identityService,
                    signalLogService,
                    marketDataProvider,
                    properties,
                    executor,
                    clock
            );

            SignalBatchResult result = service.evaluate(EvaluationMode.CLOSE, null);

            assertThat(result.errors()).isEmpty();
            assertThat(result.signals()).singleElement().satisfies(signal -> {
                assertThat(signal.mode()).isEqualTo(SignalMode.CONFIRMED);
                assertThat(stateService.findLastSignal("BTCUSDT").orElseThrow().id()).isEqualTo(signal.id());
            });
            assertThat(stateService.findPending("BTCUSDT")).isEmpty();
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void watchlist_normalizesAndDeduplicates() {
        SignalBatchService service = service(
                SignalFixtures.signalProperties(List.of(" btcusdt ", "", "BTCUSDT", "ethusdt")),
                Runnable::run
        );

        assertThat(service.watchlist()).containsExactly("BTCUSDT", "ETHUSDT");
    }

    @Test
    void requestConfirmation_normalizesWatchedSymbol() {
        SignalBatchService service = service(SignalFixtures.signalProperties(), Runnable::run);
        when(signalLifecycleService.requestConfirmation("BTCUSDT")).thenReturn(ConfirmationResult.accepted());

        ConfirmationResult result = service.requestConfirmation(" btcusdt");

        assertThat(result.ok()).isTrue();
    }

    @Test
    void requestConfirmation_rejectsSymbolOutsideWatchlist() {
        SignalBatchService service = service(SignalFixtures.signalProperties(), Runnable::run);

        assertThatThrownBy(() -> service.requestConfirmation("DOGEUSDT"))
                .isInstanceOfSatisfying(SignalApiException.class, exception -> {
                    assertThat(exception.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(exception.getCode()).isEqualTo("symbol_not_in_watchlist");
                });
        verify(signalLifecycleService, never()).requestConfirmation(any());
    }

    @Test
    void state_delegatesForWatchedSymbol() {
        SignalBatchService service = service(SignalFixtures.signalProperties(), Runnable::run);
        SignalStateDto state = new SignalStateDto("ETHUSDT", null, null, null);
        when(signalStateService.snapshot("ETHUSDT")).thenReturn(state);

        assertThat(service.state("ethusdt")).isEqualTo(state);
    }

    @Test
    void state_rejectsBlankSymbol() {
        SignalBatchService service = service(SignalFixtures.signalProperties(), Runnable::run);

        assertThatThrownBy(() -> service.state("  ")).isInstanceOf(SignalApiException.class);
    }

    private SignalBatchService service(SignalProperties properties, Executor executor) {
        return new SignalBatchService(
                signalLifecycleService,
                signalStateService,
                signalIdentityService,
                signalLogService,
                marketDataProvider,
                properties,
                executor,
                CLOCK
        );
    }

    private SignalLifecycleService realLifecycle(
            SignalProperties properties,
            InMemorySignalStateStore store,
            SignalStateService stateService,
            SignalIdentityService identityService,
            Clock clock
    ) {
        InstrumentMetadataService metadataService = mock(InstrumentMetadataService.class);
        SignalIndicatorService indicatorService = mock(SignalIndicatorService.class);
        when(metadataService.pricePrecision("BTCUSDT")).thenReturn(2);
        when(indicatorService.snapshot(any(), eq(14))).thenReturn(SignalFixtures.bullishIndicators());

        SignalPipelineService pipeline = new SignalPipelineService(
                marketDataProvider,
                metadataService,
                new LiquidationFeedService(store),
                indicatorService,
                new MarketClassifierService(properties),
                new DirectionSelectorService(),
                new ConfidenceScorerService(),
                new LiquidationRiskService(properties),
                new TargetPlannerService(properties),
                properties,
                clock
        );
        return new SignalLifecycleService(
                pipeline,
                stateService,
                identityService,
                new SignalLogService(),
                marketDataProvider,
                properties,
                clock
        );
    }

    private SignalDto preview(String symbol) {
        return new SignalDto(
                "preview-" + symbol,
                symbol,
                SignalMode.PREVIEW,
                TradeDirection.LONG,
                79,
                new BigDecimal("100.0"),
                new BigDecimal("96.00"),
                new BigDecimal("108.00"),
                Map.of(),
                List.of("UPTREND_RSI_OK"),
                List.of(),
                CLOCK.instant(),
                null
        );
    }
}
