package org.nowstart.beacon.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.nowstart.beacon.data.type.SignalMode;
import org.nowstart.beacon.data.type.TradeDirection;

public record SignalDto(
        String id,
        String symbol,
        SignalMode mode,
        TradeDirection direction,
        int confidence,
        BigDecimal entryPrice,
        BigDecimal stopLossPrice,
        BigDecimal takeProfitPrice,
        Map<String, Object> metadata,
        List<String> reasonCodes,
        List<String> warnings,
        Instant createdAt,
        Instant confirmedAt
) {

    public SignalDto {
        metadata = metadata == null ? Map.of() : metadata;
        reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static SignalDto invalidated(String id, String symbol, String reason, Instant now) {
        return new SignalDto(
                id,
                symbol,
                SignalMode.INVALIDATED,
                TradeDirection.NONE,
                0,
                null,
                null,
                null,
                Map.of(),
                List.of(reason),
                List.of(),
                now,
                null
        );
    }
}
