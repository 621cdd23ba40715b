package org.nowstart.beacon.service.strategy.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record RiskAdjustment(
        int adjustedConfidence,
        boolean veto,
        Set<String> warnings
) {

    public RiskAdjustment {
        warnings = warnings == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(warnings));
    }
}
