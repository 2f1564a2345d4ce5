package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.config.ProgressionProperties.NavigatorParams;
import com.aiinpocket.ngplus.model.enums.CycleState;
import com.aiinpocket.ngplus.model.enums.PatternKind;
import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.CycleView;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.SkillView;
import com.aiinpocket.ngplus.service.navigator.PatternDetector;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 已就緒技能近期週期的目標命中率偏低，只回報最差的技能。
 */
@Component
public class CycleUnderperformanceDetector implements PatternDetector {

    @Override
    public PatternKind getKind() {
        return PatternKind.CYCLE_UNDERPERFORMANCE;
    }

    @Override
    public Optional<DetectedPattern> detect(NavigatorSnapshot snapshot) {
        NavigatorParams params = snapshot.params();
        return snapshot.skills().stream()
                .filter(skill -> skill.state() == CycleState.ACTIVE)
                .map(skill -> evaluate(skill, snapshot, params))
                .flatMap(Optional::stream)
                .max(Comparator.comparingDouble(DetectedPattern::confidence));
    }

    private Optional<DetectedPattern> evaluate(SkillView skill, NavigatorSnapshot snapshot, NavigatorParams params) {
        List<CycleView> window = snapshot.cyclesOf(skill.id()).stream()
                .filter(CycleView::ready)
                .limit(params.cycleWindow())
                .toList();
        int samples = window.size();
        if (samples < params.cycleMinSamples()) {
            return Optional.empty();
        }
        long hits = window.stream().filter(CycleView::targetHit).count();
        double hitRate = (double) hits / samples;
        if (hitRate >= params.underperformanceHitRate()) {
            return Optional.empty();
        }
        double confidence = (1.0 - hitRate) * Math.min(1.0, (double) samples / params.cycleWindow());
        String message = String.format("%s hit its cycle target in %d of the last %d cycles.",
                skill.name(), hits, samples);
        return Optional.of(new DetectedPattern(getKind(), skill.id(), confidence, message, window.get(0).cycleEnd()));
    }
}
