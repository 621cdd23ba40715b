package org.nowstart.beacon.repository;

import java.util.List;
import org.nowstart.beacon.config.CoinGeckoFeignConfig;
import org.nowstart.beacon.data.dto.CoinGeckoDerivativeResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;

@FeignClient(
        name = "coinGeckoClient",
        url = "${beacon.market.coingecko-base-url:https://api.coingecko.com}",
        configuration = CoinGeckoFeignConfig.class
)
public interface CoinGeckoFeignClient {

    @GetMapping("/api/v3/derivatives")
    List<CoinGeckoDerivativeResponse> getDerivatives();
}
