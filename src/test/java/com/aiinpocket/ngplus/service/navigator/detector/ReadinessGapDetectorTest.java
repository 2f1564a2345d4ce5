package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.model.enums.CycleState;
import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import org.junit.jupiter.api.Test;

import static com.aiinpocket.ngplus.service.navigator.SnapshotFixture.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class ReadinessGapDetectorTest {

    private final ReadinessGapDetector detector = new ReadinessGapDetector();

    @Test
    void longNotReadySkillIsReported() {
        DetectedPattern pattern = detector.detect(snapshot()
                .skill("writing", 1, false, CycleState.NOT_READY, 6)
                .skill("reading", 1, false, CycleState.NOT_READY, 1)
                .build()).orElseThrow();

        assertEquals("reading", pattern.subject());
        assertEquals(1.0, pattern.confidence(), 1e-9);
        assertTrue(pattern.message().contains("7 more"));
    }

    @Test
    void enoughMissionsAwaitingRolloverIsSilent() {
        assertTrue(detector.detect(snapshot().skill("writing", 1, false, CycleState.NOT_READY, 8).build()).isEmpty());
        assertTrue(detector.detect(snapshot().skill("writing", 1, false, CycleState.ACTIVE, 2).build()).isEmpty());
    }
}
