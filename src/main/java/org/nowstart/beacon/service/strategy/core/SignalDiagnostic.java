package org.nowstart.beacon.service.strategy.core;

/**
 * One named value observed while evaluating a symbol, for logs and dashboards only.
 *
 * <p>Keys are stable and machine-readable ({@code rsi}, {@code macd.histogram}, {@code confidence.final}),
 * labels are for display.
 *
 * @param key   stable diagnostic identifier
 * @param label human-readable name
 * @param type  expected value type
 * @param unit  unit for numeric values, empty otherwise
 * @param value actual diagnostic value
 */
public record SignalDiagnostic(
        String key,
        String label,
        SignalDiagnosticType type,
        String unit,
        Object value
) {

    public SignalDiagnostic {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("diagnostic key is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("diagnostic type is required");
        }
        if (value == null) {
            throw new IllegalArgumentException("diagnostic value is required");
        }
        label = (label == null || label.isBlank()) ? key : label;
        unit = unit == null ? "" : unit;
        if (!type.supports(value)) {
            throw new IllegalArgumentException("diagnostic " + key + " must be " + type.typeName());
        }
    }

    public static SignalDiagnostic number(String key, String label, String unit, double value) {
        return new SignalDiagnostic(key, label, SignalDiagnosticType.NUMBER, unit, value);
    }

    public static SignalDiagnostic bool(String key, String label, boolean value) {
        return new SignalDiagnostic(key, label, SignalDiagnosticType.BOOLEAN, "", value);
    }

    public static SignalDiagnostic text(String key, String label, String value) {
        return new SignalDiagnostic(key, label, SignalDiagnosticType.STRING, "", value == null ? "" : value);
    }

    public double numericValue() {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        return Double.NaN;
    }
}
