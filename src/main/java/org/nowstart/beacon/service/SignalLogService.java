package org.nowstart.beacon.service;

import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.beacon.data.dto.SignalBatchResult;
import org.nowstart.beacon.data.dto.SignalDto;
import org.nowstart.beacon.data.type.EvaluationMode;
import org.nowstart.beacon.service.strategy.core.SignalDiagnostic;
import org.nowstart.beacon.service.strategy.core.SignalEvaluation;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SignalLogService {

    public void logSignal(SignalDto signal, SignalEvaluation evaluation) {
        log.info(
                "event=signal_{} symbol={} id={} direction={} confidence={} entry={} sl={} tp={} reasons={} warnings={} diagnostics={}",
                signal.mode().name().toLowerCase(Locale.ROOT),
                signal.symbol(),
                signal.id(),
                signal.direction(),
                signal.confidence(),
                signal.entryPrice(),
                signal.stopLossPrice(),
                signal.takeProfitPrice(),
                signal.reasonCodes(),
                signal.warnings(),
                formatDiagnosticValues(evaluation)
        );

        emitDiagnostics(signal.symbol(), signal.mode().name(), evaluation);
    }

    public void logInvalidated(SignalDto signal, SignalEvaluation evaluation) {
        log.info(
                "event=signal_invalidated symbol={} id={} reason={} diagnostics={}",
                signal.symbol(),
                signal.id(),
                signal.reasonCodes(),
                formatDiagnosticValues(evaluation)
        );
    }

    public void logSkipped(EvaluationMode mode, String symbol, String reason, SignalEvaluation evaluation) {
        log.info(
                "event=signal_skipped mode={} symbol={} reason={} confidence={} diagnostics={}",
                mode,
                symbol,
                reason,
                evaluation == null ? 0 : evaluation.confidence(),
                formatDiagnosticValues(evaluation)
        );
    }

    public void logBatch(SignalBatchResult result) {
        log.info(
                "event=signal_batch mode={} symbol_count={} signal_count={} error_count={} elapsed_ms={}",
                result.mode(),
                result.watchlist().size(),
                result.signals().size(),
                result.errors().size(),
                result.elapsedMs()
        );
    }

    private void emitDiagnostics(String symbol, String mode, SignalEvaluation evaluation) {
        for (SignalDiagnostic diagnostic : evaluation.diagnostics()) {
            if (!diagnostic.type().isSeries()) {
                continue;
            }
            log.info(
                    "event=signal_diagnostic symbol={} mode={} key={} label=\"{}\" unit={} value={}",
                    symbol,
                    mode,
                    diagnostic.key(),
                    escape(diagnostic.label()),
                    diagnostic.unit(),
                    sanitizeMetricForLog(diagnostic.numericValue())
            );
        }
    }

    private String formatDiagnosticValues(SignalEvaluation evaluation) {
        if (evaluation == null) {
            return "{}";
        }
        return evaluation.diagnostics().stream()
                .sorted(Comparator.comparing(SignalDiagnostic::key))
                .map(item -> item.key() + "=" + formatDiagnosticValue(item))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private String formatDiagnosticValue(SignalDiagnostic diagnostic) {
        if (diagnostic.type().isSeries()) {
            return Double.toString(sanitizeMetricForLog(diagnostic.numericValue()));
        }
        return "\"" + escape(String.valueOf(diagnostic.value())) + "\"";
    }

    private String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private double sanitizeMetricForLog(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return value == -0.0 ? 0.0 : value;
    }
}
