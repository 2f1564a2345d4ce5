package com.aiinpocket.ngplus.model.dto;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * 遊戲狀態完整匯出。保留所有 id，匯入後每個參照都能還原。
 * 連續紀錄、目標與模板為選填，舊版匯出檔仍可匯入。
 */
public record GameSnapshot(
        int version,
        Instant exportedAt,
        PlayerData player,
        List<SkillData> skills,
        List<MissionData> missions,
        List<CompletionData> completions,
        List<CycleRecordData> cycleRecords,
        List<RewardData> rewards,
        List<RedemptionData> redemptions,
        List<JournalData> journal,
        List<CapsuleData> capsules,
        List<StreakData> streaks,
        List<GoalData> goals,
        List<TemplateData> templates
) {
    public static final int CURRENT_VERSION = 1;

    public record PlayerData(
            String id, String displayName, String className, String classDescription,
            int level, long xp, long coins, int dayStartHour, Instant createdAt
    ) {}

    public record SkillData(
            String id, String name, String description, int level, long xp,
            String cadence, int customIntervalDays, Instant cycleStart, Instant cycleEnd,
            String targetMissionId, boolean hitTargetThisCycle, boolean focus, boolean archived,
            Instant notReadySince, Instant createdAt
    ) {}

    public record MissionData(
            String id, String title, String note, int difficulty, int energy,
            List<String> skillIds, boolean archived, Instant createdAt, Instant updatedAt
    ) {}

    public record CompletionData(
            String id, String missionId, int difficulty, Instant completedAt,
            long basePlayerXp, long cyclePlayerXp, long coins, boolean reflectionToken,
            List<AwardData> awards
    ) {}

    public record AwardData(
            String skillId, String cycleId, long baseSkillXp, long cycleSkillXp, boolean cycleAward
    ) {}

    public record CycleRecordData(
            String id, String skillId, String cycleId, Instant cycleStart, Instant cycleEnd,
            String targetMissionId, boolean ready, boolean targetHit
    ) {}

    public record RewardData(
            String id, String title, long priceCoins, String note, boolean archived,
            int timesRedeemed, Instant createdAt
    ) {}

    public record RedemptionData(
            String id, String rewardId, long coinsSpent, Instant redeemedAt, String note
    ) {}

    public record JournalData(
            String id, String text, String skillId, String missionId, boolean reflection,
            Instant createdAt, Instant editedAt
    ) {}

    public record CapsuleData(
            String id, String title, String body, boolean encrypted, String passphraseHint,
            String unlockType, String unlockParams, Instant createdAt, Instant unlockedAt,
            String archivedToJournalEntryId
    ) {}

    public record StreakData(
            String id, String skillId, int currentStreak, int longestStreak,
            LocalDate lastCompletionDate, Instant createdAt
    ) {}

    public record GoalData(
            String id, String title, String description, String goalType, long targetValue,
            long currentValue, String status, String skillId, List<Long> milestones,
            Instant deadline, Instant createdAt, Instant completedAt
    ) {}

    public record TemplateData(
            String id, String name, String description, String category,
            List<TemplateRequest.Entry> missions, int timesUsed, Instant createdAt
    ) {}
}
