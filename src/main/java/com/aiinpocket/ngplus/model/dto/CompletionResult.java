package com.aiinpocket.ngplus.model.dto;

import java.time.Instant;
import java.util.List;

/**
 * 單次任務完成的獎勵內容，回傳給 {@code completeMission} 的呼叫端。
 */
public record CompletionResult(
        String completionId,
        String missionId,
        Instant completedAt,
        long playerXp,
        long coins,
        boolean reflectionToken,
        String reflectionPrompt,
        LevelUpResult player,
        List<SkillAwardResult> skills
) {
    public record SkillAwardResult(
            String skillId,
            String skillName,
            long skillXp,
            boolean cycleBonus,
            LevelUpResult levelUp
    ) {}

    public boolean anyCycleBonus() {
        return skills.stream().anyMatch(SkillAwardResult::cycleBonus);
    }
}
