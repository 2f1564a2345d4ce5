package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.model.enums.CycleState;
import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import org.junit.jupiter.api.Test;

import static com.aiinpocket.ngplus.service.navigator.SnapshotFixture.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class CycleUnderperformanceDetectorTest {

    private final CycleUnderperformanceDetector detector = new CycleUnderperformanceDetector();

    @Test
    void reportsWorstActiveSkill() {
        DetectedPattern pattern = detector.detect(snapshot()
                .skill("writing", 3).skill("reading", 3)
                .cycles("writing", true, false, false, false, false)
                .cycles("reading", false, false, false, false, false)
                .build()).orElseThrow();

        assertEquals("reading", pattern.subject());
        assertEquals(1.0, pattern.confidence());
    }

    @Test
    void fewSamplesLowerConfidence() {
        DetectedPattern pattern = detector.detect(snapshot()
                .skill("writing", 3)
                .cycles("writing", false, false)
                .build()).orElseThrow();

        assertEquals(0.4, pattern.confidence(), 1e-9);
    }

    @Test
    void healthyHitRateOrTooFewCyclesIsSilent() {
        assertTrue(detector.detect(snapshot().skill("writing", 3)
                .cycles("writing", true, true, false, false, false).build()).isEmpty());
        assertTrue(detector.detect(snapshot().skill("writing", 3)
                .cycles("writing", false).build()).isEmpty());
    }

    @Test
    void notReadySkillsAreIgnored() {
        assertTrue(detector.detect(snapshot().skill("writing", 3, false, CycleState.NOT_READY, 2)
                .cycles("writing", false, false, false).build()).isEmpty());
    }
}
