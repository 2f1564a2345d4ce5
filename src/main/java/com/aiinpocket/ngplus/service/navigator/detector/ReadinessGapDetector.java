package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.model.enums.CycleState;
import com.aiinpocket.ngplus.model.enums.PatternKind;
import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.SkillView;
import com.aiinpocket.ngplus.service.navigator.PatternDetector;
import com.aiinpocket.ngplus.service.progression.TimeAlignment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;

/**
 * 技能維持 NOT_READY 超過一個週期。
 */
@Component
public class ReadinessGapDetector implements PatternDetector {

    @Override
    public PatternKind getKind() {
        return PatternKind.READINESS_GAP;
    }

    @Override
    public Optional<DetectedPattern> detect(NavigatorSnapshot snapshot) {
        return snapshot.skills().stream()
                .filter(skill -> skill.state() == CycleState.NOT_READY && skill.notReadySince() != null)
                .filter(skill -> Duration.between(skill.notReadySince(), snapshot.now())
                        .compareTo(TimeAlignment.cadencePeriod(skill.cadence(), skill.customIntervalDays())) > 0)
                .map(skill -> toPattern(skill, snapshot))
                .flatMap(Optional::stream)
                .max(Comparator.comparingDouble(DetectedPattern::confidence)
                        .thenComparing(DetectedPattern::relevantAt, Comparator.reverseOrder()));
    }

    private Optional<DetectedPattern> toPattern(SkillView skill, NavigatorSnapshot snapshot) {
        int missing = snapshot.readinessThreshold() - skill.assignedMissions();
        if (missing <= 0) {
            // 任務已足夠，下次輪替會抽出目標
            return Optional.empty();
        }
        double confidence = Math.min(1.0, 0.4 + 0.1 * missing);
        String message = String.format("%s has %d mission(s) and needs %d more to get cycle targets.",
                skill.name(), skill.assignedMissions(), missing);
        return Optional.of(new DetectedPattern(getKind(), skill.id(), confidence, message, skill.notReadySince()));
    }
}
