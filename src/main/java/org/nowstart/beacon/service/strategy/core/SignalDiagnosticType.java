package org.nowstart.beacon.service.strategy.core;

// 숫자/불리언만 개별 signal_diagnostic 로그로 출력
public enum SignalDiagnosticType {
    NUMBER(Number.class),
    BOOLEAN(Boolean.class),
    STRING(String.class);

    private final Class<?> valueType;

    SignalDiagnosticType(Class<?> valueType) {
        this.valueType = valueType;
    }

    public boolean supports(Object value) {
        return valueType.isInstance(value);
    }

    public String typeName() {
        return valueType.getSimpleName();
    }

    public boolean isSeries() {
        return this != STRING;
    }
}
