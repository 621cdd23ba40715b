package org.nowstart.beacon.data.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.nowstart.beacon.data.type.SignalMode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LastSignalPointer(
        Instant ts,
        String id,
        SignalMode mode,
        String reason
) {
}
