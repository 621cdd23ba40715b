package org.nowstart.beacon.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoinApiSymbolResponse(
        String symbol_id,
        String exchange_id,
        String symbol_type,
        String asset_id_base,
        String asset_id_quote,
        BigDecimal price_precision,
        BigDecimal size_precision
) {
}
