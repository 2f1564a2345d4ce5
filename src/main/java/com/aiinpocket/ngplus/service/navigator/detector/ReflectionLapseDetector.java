package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.model.enums.PatternKind;
import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.SkillView;
import com.aiinpocket.ngplus.service.navigator.PatternDetector;
import com.aiinpocket.ngplus.service.progression.TimeAlignment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * 技能持續有完成，但超過 {@code lapseCadenceMultiplier} 個週期
 * 都沒有相關（或任何）日誌。
 */
@Component
public class ReflectionLapseDetector implements PatternDetector {

    @Override
    public PatternKind getKind() {
        return PatternKind.REFLECTION_LAPSE;
    }

    @Override
    public Optional<DetectedPattern> detect(NavigatorSnapshot snapshot) {
        return snapshot.skills().stream()
                .map(skill -> evaluate(skill, snapshot))
                .flatMap(Optional::stream)
                .max(Comparator.comparingDouble(DetectedPattern::confidence));
    }

    private Optional<DetectedPattern> evaluate(SkillView skill, NavigatorSnapshot snapshot) {
        Optional<Instant> lastCompletion = snapshot.lastCompletionOf(skill.id());
        if (lastCompletion.isEmpty()) {
            return Optional.empty();
        }
        Instant lastJournal = latest(snapshot.lastJournalBySkill().get(skill.id()), snapshot.lastUnlinkedJournal());
        Instant reference = lastJournal != null ? lastJournal : skill.createdAt();
        if (!lastCompletion.get().isAfter(reference)) {
            return Optional.empty();
        }

        Duration period = TimeAlignment.cadencePeriod(skill.cadence(), skill.customIntervalDays());
        double limitSeconds = period.getSeconds() * snapshot.params().lapseCadenceMultiplier();
        double ratio = Duration.between(reference, snapshot.now()).getSeconds() / limitSeconds;
        if (ratio <= 1.0) {
            return Optional.empty();
        }
        double confidence = Math.min(1.0, 0.4 + 0.2 * (ratio - 1.0));
        long days = Duration.between(reference, snapshot.now()).toDays();
        String message = lastJournal == null
                ? String.format("You have been training %s but have not journaled about it yet.", skill.name())
                : String.format("No journal activity on %s for %d days.", skill.name(), days);
        return Optional.of(new DetectedPattern(getKind(), skill.id(), confidence, message, lastCompletion.get()));
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
