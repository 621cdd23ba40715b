package org.nowstart.beacon.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.beacon.data.dto.ConfirmationResult;
import org.nowstart.beacon.data.dto.SignalBatchResult;
import org.nowstart.beacon.data.dto.SignalDto;
import org.nowstart.beacon.data.dto.SignalErrorEntry;
import org.nowstart.beacon.data.dto.SignalStateDto;
import org.nowstart.beacon.data.exception.SignalApiException;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.data.type.EvaluationMode;
import org.nowstart.beacon.service.strategy.core.MarketContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Fans one evaluation mode out over the watch-list and collects signals and per-symbol errors.
 *
 * <p>Every symbol task is joined before the result is built, so a lifecycle transition committed by a task is always
 * reported. Slow symbols are bounded by the Feign client timeouts only. Nothing is retried: a symbol that failed is
 * simply evaluated again on the next invocation.
 */
@Slf4j
@Service
@RefreshScope
public class SignalBatchService {

    private final SignalLifecycleService signalLifecycleService;
    private final SignalStateService signalStateService;
    private final SignalIdentityService signalIdentityService;
    private final SignalLogService signalLogService;
    private final MarketDataProvider marketDataProvider;
    private final SignalProperties signalProperties;
    private final Executor signalEvaluationExecutor;
    private final Clock clock;

    public SignalBatchService(
            SignalLifecycleService signalLifecycleService,
            SignalStateService signalStateService,
            SignalIdentityService signalIdentityService,
            SignalLogService signalLogService,
            MarketDataProvider marketDataProvider,
            SignalProperties signalProperties,
            @Qualifier("signalEvaluationExecutor") Executor signalEvaluationExecutor,
            Clock clock
    ) {
        this.signalLifecycleService = signalLifecycleService;
        this.signalStateService = signalStateService;
        this.signalIdentityService = signalIdentityService;
        this.signalLogService = signalLogService;
        this.marketDataProvider = marketDataProvider;
        this.signalProperties = signalProperties;
        this.signalEvaluationExecutor = signalEvaluationExecutor;
        this.clock = clock;
    }

    public SignalBatchResult evaluate(EvaluationMode mode, Integer minConfidence) {
        long startedAt = clock.millis();
        List<String> watchlist = watchlist();

        // 컨텍스트는 배치당 한 번만 조회
        Map<String, MarketContext> contexts = marketDataProvider.fetchContexts(watchlist);

        List<CompletableFuture<SymbolOutcome>> futures = watchlist.stream()
                .map(symbol -> CompletableFuture
                        .supplyAsync(() -> evaluateSymbol(mode, symbol, contexts.get(symbol), minConfidence), signalEvaluationExecutor)
                        .exceptionally(throwable -> failed(mode, symbol, throwable)))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SignalDto> signals = new ArrayList<>();
        List<SignalErrorEntry> errors = new ArrayList<>();
        for (CompletableFuture<SymbolOutcome> future : futures) {
            SymbolOutcome outcome = future.join();
            outcome.signal().ifPresent(signals::add);
            if (outcome.error() != null) {
                errors.add(outcome.error());
            }
        }

        SignalBatchResult result = new SignalBatchResult(
                mode,
                watchlist,
                signals,
                errors,
                clock.millis() - startedAt
        );
        signalLogService.logBatch(result);
        return result;
    }

    public ConfirmationResult requestConfirmation(String symbol) {
        return signalLifecycleService.requestConfirmation(requireWatched(symbol));
    }

    public SignalStateDto state(String symbol) {
        return signalStateService.snapshot(requireWatched(symbol));
    }

    /**
     * Watch-list trimmed, upper-cased, without blanks or duplicates, in configured order.
     */
    public List<String> watchlist() {
        LinkedHashSet<String> symbols = new LinkedHashSet<>();
        for (String value : signalProperties.watchlist()) {
            String symbol = normalizeSymbol(value);
            if (!symbol.isBlank()) {
                symbols.add(symbol);
            }
        }
        return List.copyOf(symbols);
    }

    private String requireWatched(String symbol) {
        String normalized = normalizeSymbol(symbol);
        if (normalized.isBlank() || !watchlist().contains(normalized)) {
            throw new SignalApiException(
                    HttpStatus.BAD_REQUEST,
                    "symbol_not_in_watchlist",
                    "Invalid symbol or not in watchlist: " + symbol
            );
        }
        return normalized;
    }

    private SymbolOutcome evaluateSymbol(EvaluationMode mode, String symbol, MarketContext context, Integer minConfidence) {
        Optional<SignalDto> signal = mode == EvaluationMode.CLOSE
                ? signalLifecycleService.evaluateOnClose(symbol, context, minConfidence)
                : signalLifecycleService.evaluateIntrabar(symbol, context, minConfidence);
        return new SymbolOutcome(signal, null);
    }

    private SymbolOutcome failed(EvaluationMode mode, String symbol, Throwable throwable) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;
        log.error("Failed to evaluate symbol. mode={}, symbol={}", mode, symbol, cause);
        return errorOutcome(symbol, describe(cause));
    }

    private SymbolOutcome errorOutcome(String symbol, String message) {
        String id = signalIdentityService.errorId(symbol, clock.instant());
        return new SymbolOutcome(Optional.empty(), new SignalErrorEntry(id, symbol, message));
    }

    private String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }

    private String normalizeSymbol(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }

    private record SymbolOutcome(Optional<SignalDto> signal, SignalErrorEntry error) {
    }
}
