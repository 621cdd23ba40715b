package org.nowstart.beacon.data.type;

public enum TrendClass {
    UP,
    DOWN,
    SIDE
}
