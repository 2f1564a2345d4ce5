package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.config.ProgressionProperties.NavigatorParams;
import com.aiinpocket.ngplus.model.enums.PatternKind;
import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.SkillView;
import com.aiinpocket.ngplus.service.navigator.PatternDetector;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 活躍技能至少兩個時，專注技能數超出 [focusMin, focusMax]。
 */
@Component
public class FocusSaturationDetector implements PatternDetector {

    private static final String SUBJECT = "focus";

    @Override
    public PatternKind getKind() {
        return PatternKind.FOCUS_SATURATION;
    }

    @Override
    public Optional<DetectedPattern> detect(NavigatorSnapshot snapshot) {
        if (snapshot.skills().size() < 2) {
            return Optional.empty();
        }
        NavigatorParams params = snapshot.params();
        long focused = snapshot.skills().stream().filter(SkillView::focus).count();
        if (focused < params.focusMin()) {
            return Optional.of(new DetectedPattern(getKind(), SUBJECT, 0.5,
                    "No skill is in Focus. Focusing one skill doubles its level thresholds for deeper mastery.", null));
        }
        if (focused > params.focusMax()) {
            double confidence = Math.min(1.0, 0.5 + 0.2 * (focused - params.focusMax()));
            return Optional.of(new DetectedPattern(getKind(), SUBJECT, confidence,
                    String.format("%d skills are in Focus. Spreading focus this thin slows all of them.", focused), null));
        }
        return Optional.empty();
    }
}
