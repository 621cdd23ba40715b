package org.nowstart.beacon.data.type;

public enum SignalRejectReason {
    COOLDOWN_ACTIVE,
    NO_MARKET_CONTEXT,
    NO_OHLCV,
    BAD_INDICATORS,
    NO_TRADE,
    DIRECTION_CHANGED,
    REVERSAL_NOT_CONFIRMED,
    LIQ_VETO,
    CONFIDENCE_LOW,
    BAD_ENTRY,
    NO_ATR,
    DUPLICATE_SIGNAL;

    public String closeCode() {
        return "CLOSE_" + name();
    }
}
