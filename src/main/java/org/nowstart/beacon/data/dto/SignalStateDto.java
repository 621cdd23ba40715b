package org.nowstart.beacon.data.dto;

import java.time.Instant;

public record SignalStateDto(
        String symbol,
        Instant cooldownUntil,
        PendingConfirmation pending,
        LastSignalPointer lastSignal
) {
}
