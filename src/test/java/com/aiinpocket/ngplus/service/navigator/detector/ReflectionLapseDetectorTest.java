package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.aiinpocket.ngplus.service.navigator.SnapshotFixture.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class ReflectionLapseDetectorTest {

    private final ReflectionLapseDetector detector = new ReflectionLapseDetector();

    @Test
    void activeSkillWithoutRecentJournal() {
        DetectedPattern pattern = detector.detect(snapshot()
                .skill("writing", 2)
                .lastCompletion("writing", Duration.ofDays(1))
                .lastJournal("writing", Duration.ofDays(21))
                .build()).orElseThrow();

        assertEquals("writing", pattern.subject());
        assertEquals(0.4 + 0.2 * 0.5, pattern.confidence(), 1e-9);
        assertTrue(pattern.message().contains("21 days"));
    }

    @Test
    void unlinkedJournalCountsAsReflection() {
        assertTrue(detector.detect(snapshot()
                .skill("writing", 2)
                .lastCompletion("writing", Duration.ofDays(1))
                .lastJournal("writing", Duration.ofDays(30))
                .lastUnlinkedJournal(Duration.ofDays(2))
                .build()).isEmpty());
    }

    @Test
    void noCompletionSinceJournalIsSilent() {
        assertTrue(detector.detect(snapshot()
                .skill("writing", 2)
                .lastCompletion("writing", Duration.ofDays(40))
                .lastJournal("writing", Duration.ofDays(30))
                .build()).isEmpty());
    }

    @Test
    void neverJournaledFallsBackToSkillCreation() {
        DetectedPattern pattern = detector.detect(snapshot()
                .skill("writing", 2)
                .lastCompletion("writing", Duration.ofDays(1))
                .build()).orElseThrow();

        assertEquals(1.0, pattern.confidence(), 1e-9);
        assertTrue(pattern.message().contains("not journaled"));
    }
}
