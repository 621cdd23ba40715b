package org.nowstart.beacon.data.property;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "beacon.market")
public record MarketDataProperties(
        // CoinAPI REST 기본 URL
        @NotBlank @DefaultValue("https://rest.coinapi.io") String coinapiBaseUrl,
        // CoinAPI 키 (X-CoinAPI-Key 헤더)
        @DefaultValue("") String coinapiKey,
        // 무기한 선물 symbol_id 생성에 쓰는 거래소 ID
        @NotBlank @DefaultValue("BINANCE") String coinapiExchangeId,
        // CoinGecko REST 기본 URL
        @NotBlank @DefaultValue("https://api.coingecko.com") String coingeckoBaseUrl,
        // CoinGecko 데모 키 (선택)
        @DefaultValue("") String coingeckoApiKey,
        // 파생상품 마켓 필터 (예: "Binance (Futures)", 비우면 전체)
        @DefaultValue("") String coingeckoMarketFilter
) {
}
