package org.nowstart.beacon.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.beacon.data.dto.ConfirmationResult;
import org.nowstart.beacon.data.dto.LastSignalPointer;
import org.nowstart.beacon.data.dto.PendingConfirmation;
import org.nowstart.beacon.data.dto.SignalDto;
import org.nowstart.beacon.data.dto.SnapshotMetrics;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.data.type.EvaluationMode;
import org.nowstart.beacon.data.type.SignalMode;
import org.nowstart.beacon.data.type.SignalRejectReason;
import org.nowstart.beacon.service.strategy.core.IndicatorSnapshot;
import org.nowstart.beacon.service.strategy.core.MarketContext;
import org.nowstart.beacon.service.strategy.core.SignalEvaluation;
import org.nowstart.beacon.service.strategy.core.TargetPlan;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

/**
 * Per-symbol PREVIEW, confirmation request and CONFIRMED/INVALIDATED transitions.
 *
 * <p>Every read-modify-write on a symbol's cooldown and pending state runs under that symbol's lock, so overlapping
 * cycles inside one process cannot confirm the same preview twice. Across processes the dedupe claim is the only
 * guard.
 */
@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class SignalLifecycleService {

    public static final String REASON_ATR_TPSL = "ATR_TPSL";
    public static final String REASON_INDEX_ENTRY = "INDEX_ENTRY";
    public static final String REASON_CONFIRMED_ON_CLOSE = "CONFIRMED_ON_CLOSE";

    private final SignalPipelineService signalPipelineService;
    private final SignalStateService signalStateService;
    private final SignalIdentityService signalIdentityService;
    private final SignalLogService signalLogService;
    private final MarketDataProvider marketDataProvider;
    private final SignalProperties signalProperties;
    private final Clock clock;

    private final Map<String, ReentrantLock> symbolLocks = new ConcurrentHashMap<>();

    public Optional<SignalDto> evaluateIntrabar(String symbol, Integer minConfidence) {
        return evaluateIntrabar(symbol, marketDataProvider.fetchContext(symbol).orElse(null), minConfidence);
    }

    public Optional<SignalDto> evaluateIntrabar(String symbol, MarketContext context, Integer minConfidence) {
        return withSymbolLock(symbol, () -> {
            Instant now = clock.instant();
            if (signalStateService.isCoolingDown(symbol, now)) {
                signalLogService.logSkipped(EvaluationMode.INTRABAR, symbol, SignalRejectReason.COOLDOWN_ACTIVE.name(), null);
                return Optional.empty();
            }

            int threshold = minConfidence == null ? signalProperties.minConfShow() : minConfidence;
            SignalEvaluation evaluation = signalPipelineService.evaluate(symbol, context, threshold, null);
            if (!evaluation.accepted()) {
                signalLogService.logSkipped(EvaluationMode.INTRABAR, symbol, evaluation.rejectReason().name(), evaluation);
                return Optional.empty();
            }

            String signalId = signalIdentityService.previewId(symbol, evaluation.candidate().direction(), now);
            if (!signalIdentityService.claim(signalId)) {
                signalLogService.logSkipped(EvaluationMode.INTRABAR, symbol, SignalRejectReason.DUPLICATE_SIGNAL.name(), evaluation);
                return Optional.empty();
            }

            SignalDto signal = toSignal(
                    signalId,
                    SignalMode.PREVIEW,
                    evaluation,
                    List.of(REASON_ATR_TPSL, REASON_INDEX_ENTRY),
                    now,
                    null
            );

            IndicatorSnapshot indicators = evaluation.indicators();
            signalStateService.savePending(symbol, new PendingConfirmation(
                    signalId,
                    evaluation.candidate().direction(),
                    now,
                    false,
                    new SnapshotMetrics(
                            evaluation.momentum().score(),
                            indicators.bbWidthClass(),
                            indicators.atr(),
                            indicators.rsi(),
                            indicators.lastCandleCloseTime()
                    )
            ));
            signalStateService.saveLastSignal(symbol, new LastSignalPointer(now, signalId, SignalMode.PREVIEW, null));
            signalLogService.logSignal(signal, evaluation);
            return Optional.of(signal);
        });
    }

    public Optional<SignalDto> evaluateOnClose(String symbol, Integer minConfidence) {
        return evaluateOnClose(symbol, marketDataProvider.fetchContext(symbol).orElse(null), minConfidence);
    }

    public Optional<SignalDto> evaluateOnClose(String symbol, MarketContext context, Integer minConfidence) {
        return withSymbolLock(symbol, () -> {
            Optional<PendingConfirmation> pending = signalStateService.findPending(symbol);
            if (pending.isEmpty() || !pending.get().confirmRequested()) {
                return Optional.empty();
            }

            int threshold = minConfidence == null ? signalProperties.minConfConfirmed() : minConfidence;
            SignalEvaluation evaluation = signalPipelineService.evaluate(symbol, context, threshold, pending.get());
            if (!evaluation.accepted()) {
                return Optional.of(invalidate(symbol, evaluation.rejectReason().closeCode(), evaluation));
            }

            Instant now = clock.instant();
            String signalId = signalIdentityService.confirmedId(
                    symbol,
                    evaluation.candidate().direction(),
                    evaluation.indicators().lastCandleCloseTime()
            );
            if (!signalIdentityService.claim(signalId)) {
                signalLogService.logSkipped(EvaluationMode.CLOSE, symbol, SignalRejectReason.DUPLICATE_SIGNAL.name(), evaluation);
                return Optional.empty();
            }

            SignalDto signal = toSignal(
                    signalId,
                    SignalMode.CONFIRMED,
                    evaluation,
                    List.of(REASON_CONFIRMED_ON_CLOSE, REASON_ATR_TPSL),
                    pending.get().createdAt(),
                    now
            );

            signalStateService.armCooldown(symbol, signalProperties.cooldownConfirmed());
            signalStateService.clearPending(symbol);
            signalStateService.saveLastSignal(symbol, new LastSignalPointer(now, signalId, SignalMode.CONFIRMED, null));
            signalLogService.logSignal(signal, evaluation);
            return Optional.of(signal);
        });
    }

    public ConfirmationResult requestConfirmation(String symbol) {
        return withSymbolLock(symbol, () -> {
            Optional<PendingConfirmation> pending = signalStateService.findPending(symbol);
            if (pending.isEmpty()) {
                log.info("event=confirm_request symbol={} ok=false reason={}", symbol, ConfirmationResult.NO_PENDING_PREVIEW);
                return ConfirmationResult.rejected(ConfirmationResult.NO_PENDING_PREVIEW);
            }

            signalStateService.savePending(symbol, pending.get().withConfirmRequested());
            log.info("event=confirm_request symbol={} ok=true signal_id={}", symbol, pending.get().signalId());
            return ConfirmationResult.accepted();
        });
    }

    private SignalDto invalidate(String symbol, String reason, SignalEvaluation evaluation) {
        Instant now = clock.instant();
        String signalId = signalIdentityService.invalidatedId(symbol, now, reason);

        signalStateService.armCooldown(symbol, signalProperties.cooldownInvalidated());
        signalStateService.clearPending(symbol);
        signalStateService.saveLastSignal(symbol, new LastSignalPointer(now, signalId, SignalMode.INVALIDATED, reason));

        SignalDto signal = SignalDto.invalidated(signalId, symbol, reason, now);
        signalLogService.logInvalidated(signal, evaluation);
        return signal;
    }

    private SignalDto toSignal(
            String signalId,
            SignalMode mode,
            SignalEvaluation evaluation,
            List<String> trailingReasons,
            Instant createdAt,
            Instant confirmedAt
    ) {
        TargetPlan plan = evaluation.plan();
        int precision = evaluation.pricePrecision();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("atr", plan.atrUsed());
        metadata.put("slAtrMultiplier", plan.slAtrMultiplier());
        metadata.put("riskRewardRatio", plan.riskRewardRatio());
        metadata.put("pricePrecision", precision);
        metadata.put("providerSymbolId", evaluation.providerSymbolId());
        if (evaluation.context().market() != null) {
            metadata.put("contextMarket", evaluation.context().market());
        }

        List<String> reasons = new ArrayList<>();
        reasons.add(evaluation.candidate().reasonCode());
        reasons.add("TREND=" + evaluation.trend());
        reasons.add("MOM=" + evaluation.momentum().strength());
        reasons.addAll(trailingReasons);

        return new SignalDto(
                signalId,
                evaluation.symbol(),
                mode,
                evaluation.candidate().direction(),
                evaluation.confidence(),
                BigDecimal.valueOf(evaluation.entryPrice()),
                toPrice(plan.stopLossPrice(), precision),
                toPrice(plan.takeProfitPrice(), precision),
                Collections.unmodifiableMap(metadata),
                reasons,
                List.copyOf(evaluation.risk().warnings()),
                createdAt,
                confirmedAt
        );
    }

    private BigDecimal toPrice(double value, int precision) {
        return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP);
    }

    private <T> T withSymbolLock(String symbol, Supplier<T> action) {
        ReentrantLock lock = symbolLocks.computeIfAbsent(symbol, ignored -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
