package org.nowstart.beacon.data.type;

public enum MomentumStrength {
    WEAK,
    MED,
    STRONG
}
