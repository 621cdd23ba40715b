package org.nowstart.beacon.data.dto;

import java.util.List;
import org.nowstart.beacon.data.type.EvaluationMode;

public record SignalBatchResult(
        EvaluationMode mode,
        List<String> watchlist,
        List<SignalDto> signals,
        List<SignalErrorEntry> errors,
        long elapsedMs
) {
}
