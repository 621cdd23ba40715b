package org.nowstart.beacon.data.type;

public enum SignalMode {
    PREVIEW,
    CONFIRMED,
    INVALIDATED
}
