package com.aiinpocket.ngplus.service.navigator;

import com.aiinpocket.ngplus.model.dto.Suggestion;
import com.aiinpocket.ngplus.model.enums.CycleState;
import com.aiinpocket.ngplus.model.enums.PatternKind;
import com.aiinpocket.ngplus.model.enums.SuggestionPriority;
import com.aiinpocket.ngplus.service.navigator.detector.CoinHoardingDetector;
import com.aiinpocket.ngplus.service.navigator.detector.CycleUnderperformanceDetector;
import com.aiinpocket.ngplus.service.navigator.detector.DifficultySkewDetector;
import com.aiinpocket.ngplus.service.navigator.detector.FocusSaturationDetector;
import com.aiinpocket.ngplus.service.navigator.detector.ReadinessGapDetector;
import com.aiinpocket.ngplus.service.navigator.detector.ReflectionLapseDetector;
import com.aiinpocket.ngplus.service.navigator.detector.SkillImbalanceDetector;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.aiinpocket.ngplus.service.navigator.SnapshotFixture.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class NavigatorEngineTest {

    private static final NavigatorEngine ENGINE = new NavigatorEngine(List.of(
            new DifficultySkewDetector(), new SkillImbalanceDetector(), new CycleUnderperformanceDetector(),
            new ReadinessGapDetector(), new ReflectionLapseDetector(), new FocusSaturationDetector(),
            new CoinHoardingDetector()));

    @Test
    void emptyHistoryYieldsNothing() {
        assertTrue(ENGINE.analyze(snapshot().build()).isEmpty());
    }

    @Test
    void returnsAtMostThreeRankedByPriorityConfidenceAndEvidence() {
        NavigatorSnapshot snapshot = snapshot()
                .skill("writing", 6, true, CycleState.ACTIVE, 8)
                .skill("reading", 1)
                .skill("cooking", 1, false, CycleState.NOT_READY, 3)
                .cycles("reading", false, false, false, false, false)
                .coins(500)
                .build();

        List<Suggestion> suggestions = ENGINE.analyze(snapshot);

        assertEquals(List.of(PatternKind.CYCLE_UNDERPERFORMANCE, PatternKind.SKILL_IMBALANCE, PatternKind.READINESS_GAP),
                suggestions.stream().map(Suggestion::kind).toList());
        assertEquals(1.0, suggestions.get(0).confidence());
        assertEquals(0.9, suggestions.get(2).confidence(), 1e-9);
        assertTrue(suggestions.stream().allMatch(s -> s.priority() == SuggestionPriority.HIGH));
    }

    @Test
    void suggestionIdIsStableForSameSubject() {
        NavigatorSnapshot snapshot = snapshot().skill("writing", 6).skill("reading", 1).build();

        Suggestion first = ENGINE.analyze(snapshot).get(0);
        Suggestion second = ENGINE.analyze(snapshot().skill("writing", 9).skill("reading", 1).build()).get(0);

        assertEquals(first.id(), second.id());
        assertNotEquals(first.id(), ENGINE.analyze(snapshot().skill("writing", 6).skill("cardio", 1).build()).get(0).id());
    }

    @Test
    void failingDetectorIsSkipped() {
        PatternDetector broken = new PatternDetector() {
            @Override
            public PatternKind getKind() {
                return PatternKind.REFLECTION_LAPSE;
            }

            @Override
            public Optional<DetectedPattern> detect(NavigatorSnapshot snapshot) {
                throw new IllegalStateException("boom");
            }
        };
        NavigatorEngine engine = new NavigatorEngine(List.of(broken, new CoinHoardingDetector()));

        List<Suggestion> suggestions = engine.analyze(snapshot().coins(100).build());

        assertEquals(1, suggestions.size());
        assertEquals(PatternKind.COIN_HOARDING, suggestions.get(0).kind());
    }

    @Test
    void confidenceIsClampedAndBanded() {
        Suggestion high = NavigatorEngine.toSuggestion(new DetectedPattern(PatternKind.FOCUS_SATURATION, "focus", 1.7, "m", null));
        Suggestion low = NavigatorEngine.toSuggestion(new DetectedPattern(PatternKind.FOCUS_SATURATION, "focus", 0.39, "m", null));

        assertEquals(1.0, high.confidence());
        assertEquals(SuggestionPriority.HIGH, high.priority());
        assertEquals(SuggestionPriority.LOW, low.priority());
        assertEquals(PatternKind.FOCUS_SATURATION.getActionHint(), high.actionHint());
    }

    @Test
    void tiesFallBackToNewestEvidenceThenKind() {
        PatternDetector older = fixed(PatternKind.SKILL_IMBALANCE, SnapshotFixture.NOW.minus(Duration.ofDays(2)));
        PatternDetector newer = fixed(PatternKind.COIN_HOARDING, SnapshotFixture.NOW);
        PatternDetector undated = fixed(PatternKind.CYCLE_UNDERPERFORMANCE, null);

        List<Suggestion> ranked = new NavigatorEngine(List.of(older, undated, newer)).analyze(snapshot().build());

        assertEquals(List.of(PatternKind.COIN_HOARDING, PatternKind.SKILL_IMBALANCE, PatternKind.CYCLE_UNDERPERFORMANCE),
                ranked.stream().map(Suggestion::kind).toList());
    }

    private static PatternDetector fixed(PatternKind kind, Instant relevantAt) {
        return new PatternDetector() {
            @Override
            public PatternKind getKind() {
                return kind;
            }

            @Override
            public Optional<DetectedPattern> detect(NavigatorSnapshot snapshot) {
                return Optional.of(new DetectedPattern(kind, "x", 0.5, "m", relevantAt));
            }
        };
    }
}
