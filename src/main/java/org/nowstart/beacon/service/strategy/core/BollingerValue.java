package org.nowstart.beacon.service.strategy.core;

public record BollingerValue(
        double upper,
        double middle,
        double lower
) {
}
