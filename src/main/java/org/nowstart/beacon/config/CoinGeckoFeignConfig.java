package org.nowstart.beacon.config;

import feign.RequestInterceptor;
import org.nowstart.beacon.data.property.MarketDataProperties;
import org.springframework.context.annotation.Bean;

public class CoinGeckoFeignConfig {

    static final String API_KEY_HEADER = "x-cg-demo-api-key";

    @Bean
    public RequestInterceptor coinGeckoKeyRequestInterceptor(MarketDataProperties marketDataProperties) {
        return template -> {
            String apiKey = marketDataProperties.coingeckoApiKey();
            if (apiKey != null && !apiKey.isBlank()) {
                template.header(API_KEY_HEADER, apiKey);
            }
        };
    }
}
