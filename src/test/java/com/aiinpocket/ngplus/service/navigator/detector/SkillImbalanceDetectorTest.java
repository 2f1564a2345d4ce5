package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import com.aiinpocket.ngplus.service.navigator.SnapshotFixture;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.aiinpocket.ngplus.service.navigator.SnapshotFixture.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class SkillImbalanceDetectorTest {

    private final SkillImbalanceDetector detector = new SkillImbalanceDetector();

    @Test
    void firesForWideGapAndNamesWeakestSkill() {
        Optional<DetectedPattern> pattern = detector.detect(snapshot()
                .skill("writing", 6).skill("reading", 1).skill("cardio", 2)
                .lastCompletion("writing", Duration.ofHours(3))
                .build());

        assertTrue(pattern.isPresent());
        assertEquals("reading", pattern.get().subject());
        assertEquals(1.0, pattern.get().confidence());
        assertEquals(SnapshotFixture.NOW.minus(Duration.ofHours(3)), pattern.get().relevantAt());
    }

    @Test
    void confidenceScalesBelowFullGap() {
        Optional<DetectedPattern> pattern = detector.detect(snapshot().skill("writing", 4).skill("reading", 1).build());

        assertEquals(0.6, pattern.orElseThrow().confidence(), 1e-9);
    }

    @Test
    void silentWithinTwoLevels() {
        assertTrue(detector.detect(snapshot().skill("writing", 3).skill("reading", 2).skill("cardio", 1).build()).isEmpty());
        assertTrue(detector.detect(snapshot().skill("writing", 9).build()).isEmpty());
    }
}
