package com.aiinpocket.ngplus.model.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * 截至 {@code today}（玩家對齊後的日期）的連續紀錄總覽。
 */
public record StreakStatus(
        LocalDate today,
        boolean overallActive,
        int overallCurrent,
        int overallLongest,
        int skillsActive,
        int skillsAtRisk,
        List<SkillStreak> skills
) {
    /**
     * @param daysUntilBroken 1 = 明天前安全，0 = 今天必須完成，-1 = 已中斷
     */
    public record SkillStreak(
            String skillId,
            String skillName,
            int current,
            int longest,
            LocalDate lastCompletionDate,
            boolean active,
            int daysUntilBroken
    ) {}
}
