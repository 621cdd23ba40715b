package org.nowstart.beacon.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.beacon.data.dto.PendingConfirmation;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.data.type.SignalRejectReason;
import org.nowstart.beacon.data.type.TrendClass;
import org.nowstart.beacon.service.strategy.ConfidenceScorerService;
import org.nowstart.beacon.service.strategy.DirectionSelectorService;
import org.nowstart.beacon.service.strategy.LiquidationRiskService;
import org.nowstart.beacon.service.strategy.MarketClassifierService;
import org.nowstart.beacon.service.strategy.SignalIndicatorService;
import org.nowstart.beacon.service.strategy.TargetPlannerService;
import org.nowstart.beacon.service.strategy.core.CandleSeries;
import org.nowstart.beacon.service.strategy.core.DirectionCandidate;
import org.nowstart.beacon.service.strategy.core.IndicatorSnapshot;
import org.nowstart.beacon.service.strategy.core.LiquidationSnapshot;
import org.nowstart.beacon.service.strategy.core.MarketContext;
import org.nowstart.beacon.service.strategy.core.MomentumProfile;
import org.nowstart.beacon.service.strategy.core.RiskAdjustment;
import org.nowstart.beacon.service.strategy.core.SignalDiagnostic;
import org.nowstart.beacon.service.strategy.core.SignalEvaluation;
import org.nowstart.beacon.service.strategy.core.TargetPlan;
import org.nowstart.beacon.service.strategy.core.TargetPlanInput;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

/**
 * Runs indicators, classification, scoring, risk and target planning for one symbol.
 *
 * <p>Intrabar evaluation passes no pending confirmation. Close evaluation passes the pending preview so direction
 * drift and unconfirmed reversals are rejected as well. Stages run in a fixed order and the first failing stage
 * decides the reject reason.
 */
@Service
@RefreshScope
@RequiredArgsConstructor
public class SignalPipelineService {

    private final MarketDataProvider marketDataProvider;
    private final InstrumentMetadataService instrumentMetadataService;
    private final LiquidationFeedService liquidationFeedService;
    private final SignalIndicatorService signalIndicatorService;
    private final MarketClassifierService marketClassifierService;
    private final DirectionSelectorService directionSelectorService;
    private final ConfidenceScorerService confidenceScorerService;
    private final LiquidationRiskService liquidationRiskService;
    private final TargetPlannerService targetPlannerService;
    private final SignalProperties signalProperties;
    private final Clock clock;

    public SignalEvaluation evaluate(
            String symbol,
            MarketContext context,
            int minConfidence,
            PendingConfirmation pending
    ) {
        if (context == null) {
            return SignalEvaluation.rejected(symbol, SignalRejectReason.NO_MARKET_CONTEXT);
        }

        Optional<CandleSeries> series = marketDataProvider.fetchCandles(
                symbol,
                signalProperties.klinePeriod(),
                signalProperties.klineLimit()
        );
        if (series.isEmpty()) {
            return SignalEvaluation.rejected(symbol, SignalRejectReason.NO_OHLCV);
        }
        String providerSymbolId = series.get().providerSymbolId();

        IndicatorSnapshot indicators = signalIndicatorService.snapshot(series.get(), signalProperties.atrPeriod());
        List<SignalDiagnostic> diagnostics = new ArrayList<>(indicatorDiagnostics(indicators));
        Builder builder = new Builder(symbol, context, providerSymbolId, indicators, diagnostics);
        if (!indicators.isComplete()) {
            return builder.reject(SignalRejectReason.BAD_INDICATORS);
        }

        builder.trend = marketClassifierService.classifyTrend(context.percentChange24h(), indicators);
        builder.momentum = marketClassifierService.computeMomentum(indicators);
        builder.candidate = directionSelectorService.directionCandidate(builder.trend, indicators);
        diagnostics.add(SignalDiagnostic.text("trend", "Trend", builder.trend.name()));
        diagnostics.add(SignalDiagnostic.number("momentum.score", "Momentum score", "", builder.momentum.score()));
        diagnostics.add(SignalDiagnostic.text("candidate", "Direction candidate", builder.candidate.label()));
        diagnostics.add(SignalDiagnostic.bool("candidate.reversal", "Reversal candidate", builder.candidate.reversal()));
        if (builder.candidate.isNoTrade()) {
            return builder.reject(SignalRejectReason.NO_TRADE);
        }

        DirectionCandidate candidate = builder.candidate;
        if (pending != null) {
            if (candidate.direction() != pending.direction()) {
                return builder.reject(SignalRejectReason.DIRECTION_CHANGED);
            }
            int previewMomentumScore = pending.snapshotMetrics() == null
                    ? builder.momentum.score()
                    : pending.snapshotMetrics().momentumScore();
            if (candidate.reversal() && !directionSelectorService.isReversalConfirmed(
                    candidate.direction(),
                    indicators.rsi(),
                    builder.momentum.score(),
                    previewMomentumScore
            )) {
                return builder.reject(SignalRejectReason.REVERSAL_NOT_CONFIRMED);
            }
        }

        int baseConfidence = confidenceScorerService.score(builder.trend, builder.momentum, context.volatilityProxy());
        LiquidationSnapshot liquidation = liquidationFeedService.current(symbol);
        builder.risk = liquidationRiskService.adjust(
                candidate.direction(),
                baseConfidence,
                liquidation,
                context,
                clock.instant()
        );
        diagnostics.add(SignalDiagnostic.number("confidence.base", "Base confidence", "", baseConfidence));
        diagnostics.add(SignalDiagnostic.number("confidence.final", "Adjusted confidence", "", builder.risk.adjustedConfidence()));
        diagnostics.add(SignalDiagnostic.number("liq.intensity", "Liquidation intensity", "", liquidation.intensityScore()));
        diagnostics.add(SignalDiagnostic.bool("liq.veto", "Liquidation veto", builder.risk.veto()));
        if (builder.risk.veto()) {
            return builder.reject(SignalRejectReason.LIQ_VETO);
        }
        if (builder.risk.adjustedConfidence() < minConfidence) {
            return builder.reject(SignalRejectReason.CONFIDENCE_LOW);
        }

        Double entry = context.entryPrice();
        if (entry == null || !Double.isFinite(entry) || entry <= 0.0) {
            return builder.reject(SignalRejectReason.BAD_ENTRY);
        }

        builder.pricePrecision = instrumentMetadataService.pricePrecision(symbol);
        Optional<TargetPlan> plan = targetPlannerService.plan(new TargetPlanInput(
                entry,
                indicators.atr(),
                candidate.direction(),
                builder.risk.adjustedConfidence(),
                builder.momentum.strength(),
                candidate.reversal(),
                liquidation.intensityScore(),
                indicators.bbWidthClass(),
                builder.pricePrecision
        ));
        if (plan.isEmpty()) {
            Double atr = indicators.atr();
            boolean atrUsable = atr != null && Double.isFinite(atr) && atr > 0.0;
            // ATR이 정상인데 계획이 없으면 진입가가 호가 단위보다 낮은 경우
            return builder.reject(atrUsable ? SignalRejectReason.BAD_ENTRY : SignalRejectReason.NO_ATR);
        }

        diagnostics.add(SignalDiagnostic.number("plan.sl_atr_mult", "SL ATR multiplier", "x", plan.get().slAtrMultiplier()));
        diagnostics.add(SignalDiagnostic.number("plan.rr", "Risk reward", "x", plan.get().riskRewardRatio()));
        builder.plan = plan.get();
        return builder.build(null);
    }

    private List<SignalDiagnostic> indicatorDiagnostics(IndicatorSnapshot indicators) {
        List<SignalDiagnostic> diagnostics = new ArrayList<>();
        if (indicators.rsi() != null) {
            diagnostics.add(SignalDiagnostic.number("rsi", "RSI", "", indicators.rsi()));
        }
        if (indicators.macd() != null) {
            diagnostics.add(SignalDiagnostic.number("macd.histogram", "MACD histogram", "", indicators.macdHistogram()));
        }
        if (indicators.atr() != null) {
            diagnostics.add(SignalDiagnostic.number("atr", "ATR", "price", indicators.atr()));
        }
        diagnostics.add(SignalDiagnostic.number("volume.ratio", "Volume ratio", "x", indicators.volumeRatio()));
        diagnostics.add(SignalDiagnostic.number("bb.position", "Bollinger position", "", indicators.bbPosition()));
        diagnostics.add(SignalDiagnostic.text("bb.width_class", "Bollinger width", indicators.bbWidthClass().label()));
        return diagnostics;
    }

    private static final class Builder {

        private final String symbol;
        private final MarketContext context;
        private final String providerSymbolId;
        private final IndicatorSnapshot indicators;
        private final List<SignalDiagnostic> diagnostics;
        private TrendClass trend;
        private MomentumProfile momentum;
        private DirectionCandidate candidate;
        private RiskAdjustment risk;
        private int pricePrecision;
        private TargetPlan plan;

        private Builder(
                String symbol,
                MarketContext context,
                String providerSymbolId,
                IndicatorSnapshot indicators,
                List<SignalDiagnostic> diagnostics
        ) {
            this.symbol = symbol;
            this.context = context;
            this.providerSymbolId = providerSymbolId;
            this.indicators = indicators;
            this.diagnostics = diagnostics;
        }

        private SignalEvaluation reject(SignalRejectReason reason) {
            return build(reason);
        }

        private SignalEvaluation build(SignalRejectReason reason) {
            return new SignalEvaluation(
                    symbol,
                    reason,
                    context,
                    providerSymbolId,
                    indicators,
                    trend,
                    momentum,
                    candidate,
                    risk,
                    pricePrecision,
                    plan,
                    diagnostics
            );
        }
    }
}
