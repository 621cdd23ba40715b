package org.nowstart.beacon.service.strategy.core;

import java.util.List;
import org.nowstart.beacon.data.type.SignalRejectReason;
import org.nowstart.beacon.data.type.TrendClass;

/**
 * Outcome of one pass through indicators, classification, scoring, risk and target planning.
 *
 * <p>Either {@code rejectReason} is set and the trade fields are filled only up to the failing stage, or it is
 * {@code null} and every field is present.
 */
public record SignalEvaluation(
        String symbol,
        SignalRejectReason rejectReason,
        MarketContext context,
        String providerSymbolId,
        IndicatorSnapshot indicators,
        TrendClass trend,
        MomentumProfile momentum,
        DirectionCandidate candidate,
        RiskAdjustment risk,
        int pricePrecision,
        TargetPlan plan,
        List<SignalDiagnostic> diagnostics
) {

    public SignalEvaluation {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static SignalEvaluation rejected(String symbol, SignalRejectReason reason) {
        return new SignalEvaluation(symbol, reason, null, null, null, null, null, null, null, 0, null, List.of());
    }

    public boolean accepted() {
        return rejectReason == null;
    }

    public int confidence() {
        return risk == null ? 0 : risk.adjustedConfidence();
    }

    public double entryPrice() {
        return context == null || context.entryPrice() == null ? Double.NaN : context.entryPrice();
    }
}
