package org.nowstart.beacon.service.strategy.core;

public record MacdValue(
        double line,
        double signal,
        double histogram
) {
}
