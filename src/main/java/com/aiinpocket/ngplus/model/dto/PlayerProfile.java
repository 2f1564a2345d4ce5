package com.aiinpocket.ngplus.model.dto;

import java.time.Instant;
import java.util.List;

public record PlayerProfile(
        String displayName,
        String className,
        String classDescription,
        int level,
        long xp,
        long xpToNextLevel,
        double xpProgressPct,
        long coins,
        int dayStartHour,
        List<SkillSummary> skills,
        long unseenEvents
) {
    /**
     * 有目標時 {@code targetMissionId} 一律填入，
     * 是否顯示由 {@code revealTarget} 交給呈現層決定。
     */
    public record SkillSummary(
            String id,
            String name,
            int level,
            long xp,
            long xpToNextLevel,
            boolean focus,
            String cadence,
            String cycleState,
            Instant cycleStart,
            Instant cycleEnd,
            String targetMissionId,
            boolean revealTarget,
            boolean hitTargetThisCycle,
            int assignedMissions
    ) {}
}
