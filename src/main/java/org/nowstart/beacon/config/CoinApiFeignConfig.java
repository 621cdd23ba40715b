package org.nowstart.beacon.config;

import feign.RequestInterceptor;
import org.nowstart.beacon.data.property.MarketDataProperties;
import org.springframework.context.annotation.Bean;

public class CoinApiFeignConfig {

    static final String API_KEY_HEADER = "X-CoinAPI-Key";

    @Bean
    public RequestInterceptor coinApiKeyRequestInterceptor(MarketDataProperties marketDataProperties) {
        return template -> {
            String apiKey = marketDataProperties.coinapiKey();
            if (apiKey != null && !apiKey.isBlank()) {
                template.header(API_KEY_HEADER, apiKey);
            }
        };
    }
}
