package com.aiinpocket.ngplus.service.navigator;

import com.aiinpocket.ngplus.config.ProgressionProperties.NavigatorParams;
import com.aiinpocket.ngplus.model.enums.CycleCadence;
import com.aiinpocket.ngplus.model.enums.CycleState;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 偵測器所需資料的不可變副本。在單一唯讀交易內建立，
 * 分析不會看到寫到一半的完成，也不會碰到受管理的實體。
 */
public record NavigatorSnapshot(
        Instant now,
        NavigatorParams params,
        int readinessThreshold,
        int playerLevel,
        long coins,
        List<SkillView> skills,
        List<CycleView> closedCycles,
        List<CompletionView> recentCompletions,
        Map<String, Instant> lastCompletionBySkill,
        Map<String, Instant> lastJournalBySkill,
        Instant lastUnlinkedJournal,
        List<RewardView> activeRewards,
        Instant lastRedemption
) {
    public record SkillView(
            String id,
            String name,
            int level,
            boolean focus,
            CycleCadence cadence,
            int customIntervalDays,
            CycleState state,
            Instant notReadySince,
            int assignedMissions,
            Instant createdAt
    ) {}

    public record CycleView(String skillId, Instant cycleStart, Instant cycleEnd, boolean ready, boolean targetHit) {}

    /** 由新到舊 */
    public record CompletionView(String missionId, int difficulty, Instant completedAt) {}

    public record RewardView(String id, String title, long priceCoins) {}

    /** 單一技能已結算的週期，由新到舊 */
    public List<CycleView> cyclesOf(String skillId) {
        return closedCycles.stream()
                .filter(c -> c.skillId().equals(skillId))
                .sorted((a, b) -> b.cycleStart().compareTo(a.cycleStart()))
                .toList();
    }

    public Optional<Instant> lastCompletionOf(String skillId) {
        return Optional.ofNullable(lastCompletionBySkill.get(skillId));
    }
}
