package org.nowstart.beacon.data.type;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BollingerWidthClass {
    LOW("low"),
    MID("mid"),
    HIGH("high");

    private final String label;

    BollingerWidthClass(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
