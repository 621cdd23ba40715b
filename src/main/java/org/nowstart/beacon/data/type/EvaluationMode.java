package org.nowstart.beacon.data.type;

import java.util.Locale;

public enum EvaluationMode {
    INTRABAR,
    CLOSE;

    public static EvaluationMode from(String value) {
        if (value == null || value.isBlank()) {
            return INTRABAR;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
