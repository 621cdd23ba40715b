package org.nowstart.beacon.service.strategy.core;

import java.time.Instant;

public record OhlcvCandle(
        Instant openTime,
        Instant closeTime,
        double open,
        double high,
        double low,
        double close,
        double volume
) {
}
