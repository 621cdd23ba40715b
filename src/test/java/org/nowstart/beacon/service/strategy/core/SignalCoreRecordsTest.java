package org.nowstart.beacon.service.strategy.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.nowstart.beacon.data.type.SignalRejectReason;

class SignalCoreRecordsTest {

    @Test
    void signalEvaluation_defaultsDiagnosticsWhenNull() {
        SignalEvaluation evaluation = new SignalEvaluation(
                "BTCUSDT", SignalRejectReason.NO_OHLCV, null, null, null, null, null, null, null, 0, null, null
        );

        assertThat(evaluation.diagnostics()).isEmpty();
        assertThat(evaluation.accepted()).isFalse();
        assertThat(evaluation.confidence()).isZero();
        assertThat(evaluation.entryPrice()).isNaN();
    }

    @Test
    void signalEvaluation_rejectedCarriesReasonOnly() {
        SignalEvaluation evaluation = SignalEvaluation.rejected("ETHUSDT", SignalRejectReason.NO_MARKET_CONTEXT);

        assertThat(evaluation.symbol()).isEqualTo("ETHUSDT");
        assertThat(evaluation.rejectReason()).isEqualTo(SignalRejectReason.NO_MARKET_CONTEXT);
        assertThat(evaluation.plan()).isNull();
    }

    @Test
    void signalDiagnostic_requiresNonBlankKey() {
        assertThatThrownBy(() -> SignalDiagnostic.number(" ", "x", "", 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("diagnostic key is required");
    }

    @Test
    void signalDiagnostic_rejectsValueOfWrongType() {
        assertThatThrownBy(() -> new SignalDiagnostic("trend", "Trend", SignalDiagnosticType.NUMBER, "", "UP"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be Number");
    }

    @Test
    void signalDiagnostic_numberFactoryUsesKeyAsFallbackLabel() {
        SignalDiagnostic diagnostic = SignalDiagnostic.number("atr", "", null, 2.5);

        assertThat(diagnostic.label()).isEqualTo("atr");
        assertThat(diagnostic.unit()).isEmpty();
        assertThat(diagnostic.numericValue()).isEqualTo(2.5);
    }

    @Test
    void signalDiagnostic_numericValueMapsBooleansAndText() {
        assertThat(SignalDiagnostic.bool("liq.veto", "veto", true).numericValue()).isEqualTo(1.0);
        assertThat(SignalDiagnostic.text("trend", "Trend", null).value()).isEqualTo("");
        assertThat(SignalDiagnostic.text("trend", "Trend", "UP").numericValue()).isNaN();
    }
}
