package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.config.ProgressionProperties.NavigatorParams;
import com.aiinpocket.ngplus.model.enums.PatternKind;
import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.CompletionView;
import com.aiinpocket.ngplus.service.navigator.PatternDetector;
import com.aiinpocket.ngplus.service.progression.ProgressionCalculator;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 近期完成集中在最低或最高難度。
 */
@Component
public class DifficultySkewDetector implements PatternDetector {

    @Override
    public PatternKind getKind() {
        return PatternKind.DIFFICULTY_SKEW;
    }

    @Override
    public Optional<DetectedPattern> detect(NavigatorSnapshot snapshot) {
        NavigatorParams params = snapshot.params();
        Instant cutoff = snapshot.now().minus(Duration.ofDays(params.difficultyLookbackDays()));
        List<CompletionView> recent = snapshot.recentCompletions().stream()
                .filter(c -> !c.completedAt().isBefore(cutoff))
                .limit(params.difficultySampleSize())
                .toList();
        int samples = recent.size();
        if (samples < params.difficultyMinSamples()) {
            return Optional.empty();
        }

        double easyShare = share(recent, ProgressionCalculator.MIN_DIFFICULTY);
        double hardShare = share(recent, ProgressionCalculator.MAX_DIFFICULTY);
        boolean easy = easyShare >= hardShare;
        double share = easy ? easyShare : hardShare;
        if (share < params.difficultySkewShare()) {
            return Optional.empty();
        }

        double confidence = share * Math.min(1.0, samples / 10.0);
        String message = easy
                ? String.format("%d%% of your recent missions were difficulty 1. Try something harder.", Math.round(share * 100))
                : String.format("%d%% of your recent missions were difficulty 5. Easier wins keep momentum too.", Math.round(share * 100));
        return Optional.of(new DetectedPattern(getKind(), easy ? "easy" : "hard", confidence, message,
                recent.get(0).completedAt()));
    }

    private static double share(List<CompletionView> completions, int difficulty) {
        long count = completions.stream().filter(c -> c.difficulty() == difficulty).count();
        return (double) count / completions.size();
    }
}
