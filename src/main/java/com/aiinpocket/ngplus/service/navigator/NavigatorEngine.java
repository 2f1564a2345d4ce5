package com.aiinpocket.ngplus.service.navigator;

import com.aiinpocket.ngplus.model.dto.Suggestion;
import com.aiinpocket.ngplus.model.enums.SuggestionPriority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 以快照執行所有已註冊的偵測器並排序結果。
 *
 * <p>排序：優先級區間、信心值（高者優先）、最新佐證、種類順序。
 * 最多回傳 {@code maxSuggestions} 則，不修改任何狀態。
 */
@Component
@Slf4j
public class NavigatorEngine {

    private static final Comparator<Suggestion> RANKING = Comparator
            .comparing(Suggestion::priority)
            .thenComparing(Suggestion::confidence, Comparator.reverseOrder())
            .thenComparing(Suggestion::relevantAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Suggestion::kind);

    private final List<PatternDetector> detectors;

    public NavigatorEngine(List<PatternDetector> detectors) {
        this.detectors = detectors.stream()
                .sorted(Comparator.comparing(PatternDetector::getKind))
                .toList();
        log.info("[導航] 已註冊 {} 個偵測器: {}", this.detectors.size(),
                this.detectors.stream().map(PatternDetector::getKind).toList());
    }

    public List<Suggestion> analyze(NavigatorSnapshot snapshot) {
        List<Suggestion> found = new ArrayList<>();
        for (PatternDetector detector : detectors) {
            Optional<DetectedPattern> pattern;
            try {
                pattern = detector.detect(snapshot);
            } catch (RuntimeException e) {
                log.error("[導航] 偵測器 {} 執行失敗", detector.getKind(), e);
                continue;
            }
            pattern.map(NavigatorEngine::toSuggestion).ifPresent(found::add);
        }
        List<Suggestion> ranked = found.stream()
                .sorted(RANKING)
                .limit(snapshot.params().maxSuggestions())
                .toList();
        log.debug("[導航] 偵測到 {} 個模式，回傳 {} 則", found.size(), ranked.size());
        return ranked;
    }

    static Suggestion toSuggestion(DetectedPattern pattern) {
        double confidence = Math.max(0.0, Math.min(1.0, pattern.confidence()));
        String id = UUID.nameUUIDFromBytes((pattern.kind() + ":" + pattern.subject())
                .getBytes(StandardCharsets.UTF_8)).toString();
        return new Suggestion(
                id,
                pattern.kind(),
                SuggestionPriority.forConfidence(confidence),
                confidence,
                pattern.kind().getTitle(),
                pattern.message(),
                pattern.kind().getActionHint(),
                pattern.relevantAt());
    }
}
