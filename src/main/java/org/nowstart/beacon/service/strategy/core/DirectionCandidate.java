package org.nowstart.beacon.service.strategy.core;

import org.nowstart.beacon.data.type.TradeDirection;

/**
 * Proposed trade direction. A reversal candidate always resolves to a tradable base direction.
 */
public record DirectionCandidate(
        TradeDirection direction,
        boolean reversal,
        String reasonCode
) {

    public DirectionCandidate {
        if (reversal && !direction.isTradable()) {
            throw new IllegalArgumentException("reversal candidate must be LONG or SHORT");
        }
    }

    public static DirectionCandidate trend(TradeDirection direction, String reasonCode) {
        return new DirectionCandidate(direction, false, reasonCode);
    }

    public static DirectionCandidate reversal(TradeDirection direction, String reasonCode) {
        return new DirectionCandidate(direction, true, reasonCode);
    }

    public static DirectionCandidate noTrade(String reasonCode) {
        return new DirectionCandidate(TradeDirection.NO_TRADE, false, reasonCode);
    }

    public boolean isNoTrade() {
        return direction == TradeDirection.NO_TRADE;
    }

    public String label() {
        return reversal ? direction.name() + "_CANDIDATE" : direction.name();
    }
}
