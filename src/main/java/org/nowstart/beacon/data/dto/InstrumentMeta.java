package org.nowstart.beacon.data.dto;

public record InstrumentMeta(
        String symbolId,
        int pricePrecision,
        int sizePrecision
) {
}
