package org.nowstart.beacon.repository;

import java.util.List;
import org.nowstart.beacon.config.CoinApiFeignConfig;
import org.nowstart.beacon.data.dto.CoinApiOhlcvResponse;
import org.nowstart.beacon.data.dto.CoinApiSymbolResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "coinApiClient",
        url = "${beacon.market.coinapi-base-url:https://rest.coinapi.io}",
        configuration = CoinApiFeignConfig.class
)
public interface CoinApiFeignClient {

    @GetMapping("/v1/ohlcv/{symbolId}/history")
    List<CoinApiOhlcvResponse> getOhlcvHistory(
            @PathVariable("symbolId") String symbolId,
            @RequestParam("period_id") String periodId,
            @RequestParam("limit") int limit
    );

    @GetMapping("/v1/symbols/{exchangeId}/active")
    List<CoinApiSymbolResponse> getActiveSymbols(
            @PathVariable("exchangeId") String exchangeId,
            @RequestParam("filter_symbol_id") String filterSymbolId
    );
}
