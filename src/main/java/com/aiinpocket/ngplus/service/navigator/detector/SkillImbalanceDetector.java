package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.model.enums.PatternKind;
import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.SkillView;
import com.aiinpocket.ngplus.service.navigator.PatternDetector;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 最強與最弱的活躍技能等級差達到 {@code imbalanceGap} 時觸發。
 * 信心值線性成長，於 {@code imbalanceFullGap} 封頂。
 */
@Component
public class SkillImbalanceDetector implements PatternDetector {

    @Override
    public PatternKind getKind() {
        return PatternKind.SKILL_IMBALANCE;
    }

    @Override
    public Optional<DetectedPattern> detect(NavigatorSnapshot snapshot) {
        List<SkillView> skills = snapshot.skills();
        if (skills.size() < 2) {
            return Optional.empty();
        }
        SkillView strongest = skills.stream().max(Comparator.comparingInt(SkillView::level)).orElseThrow();
        SkillView weakest = skills.stream().min(Comparator.comparingInt(SkillView::level)).orElseThrow();
        int gap = strongest.level() - weakest.level();
        if (gap < snapshot.params().imbalanceGap()) {
            return Optional.empty();
        }
        double confidence = Math.min(1.0, (double) gap / snapshot.params().imbalanceFullGap());
        String message = String.format("%s is Lv.%d while %s is Lv.%d. %s could use some attention.",
                strongest.name(), strongest.level(), weakest.name(), weakest.level(), weakest.name());
        return Optional.of(new DetectedPattern(getKind(), weakest.id(), confidence, message,
                snapshot.lastCompletionOf(strongest.id()).orElse(null)));
    }
}
