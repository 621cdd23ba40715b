package org.nowstart.beacon.data.type;

public enum TradeDirection {
    LONG,
    SHORT,
    NO_TRADE,
    NONE;

    public boolean isTradable() {
        return this == LONG || this == SHORT;
    }
}
