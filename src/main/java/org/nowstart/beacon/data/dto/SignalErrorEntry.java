package org.nowstart.beacon.data.dto;

public record SignalErrorEntry(
        String id,
        String symbol,
        String error
) {
}
