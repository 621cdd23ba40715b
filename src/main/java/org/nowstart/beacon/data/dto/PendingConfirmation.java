package org.nowstart.beacon.data.dto;

import java.time.Instant;
import org.nowstart.beacon.data.type.TradeDirection;

public record PendingConfirmation(
        String signalId,
        TradeDirection direction,
        Instant createdAt,
        boolean confirmRequested,
        SnapshotMetrics snapshotMetrics
) {

    public PendingConfirmation withConfirmRequested() {
        return new PendingConfirmation(signalId, direction, createdAt, true, snapshotMetrics);
    }
}
