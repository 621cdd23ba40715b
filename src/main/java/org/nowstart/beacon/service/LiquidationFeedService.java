package org.nowstart.beacon.service;

import lombok.RequiredArgsConstructor;
import org.nowstart.beacon.repository.SignalStateStore;
import org.nowstart.beacon.service.strategy.core.LiquidationSnapshot;
import org.springframework.stereotype.Service;

/**
 * Reads the rolling liquidation snapshot an external producer writes per symbol.
 */
@Service
@RequiredArgsConstructor
public class LiquidationFeedService {

    private final SignalStateStore signalStateStore;

    public static String liquidationKey(String symbol) {
        return "liq:" + symbol;
    }

    public LiquidationSnapshot current(String symbol) {
        return signalStateStore.get(liquidationKey(symbol), LiquidationSnapshot.class)
                .orElse(LiquidationSnapshot.NEUTRAL);
    }
}
