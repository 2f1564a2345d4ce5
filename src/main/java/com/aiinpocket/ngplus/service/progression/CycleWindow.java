package com.aiinpocket.ngplus.service.progression;

import java.time.Instant;

/**
 * 半開區間 [start, end)。
 */
public record CycleWindow(Instant start, Instant end) {

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
