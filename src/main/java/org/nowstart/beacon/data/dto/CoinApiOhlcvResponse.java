package org.nowstart.beacon.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoinApiOhlcvResponse(
        String time_period_start,
        String time_period_end,
        String time_open,
        String time_close,
        BigDecimal price_open,
        BigDecimal price_high,
        BigDecimal price_low,
        BigDecimal price_close,
        BigDecimal volume_traded,
        Long trades_count
) {
}
