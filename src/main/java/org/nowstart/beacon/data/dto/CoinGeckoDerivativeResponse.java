package org.nowstart.beacon.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoinGeckoDerivativeResponse(
        String market,
        String symbol,
        String index_id,
        BigDecimal price,
        BigDecimal price_percentage_change_24h,
        String contract_type,
        BigDecimal index,
        BigDecimal basis,
        BigDecimal spread,
        BigDecimal funding_rate,
        BigDecimal open_interest,
        BigDecimal volume_24h,
        Long last_traded_at
) {
}
