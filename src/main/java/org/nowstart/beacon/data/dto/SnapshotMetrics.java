package org.nowstart.beacon.data.dto;

import java.time.Instant;
import org.nowstart.beacon.data.type.BollingerWidthClass;

public record SnapshotMetrics(
        int momentumScore,
        BollingerWidthClass bbWidthClass,
        double atr,
        double rsi,
        Instant lastCandleCloseTime
) {
}
