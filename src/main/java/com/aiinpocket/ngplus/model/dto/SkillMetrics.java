package com.aiinpocket.ngplus.model.dto;

/**
 * 技能健康指標。尚無法計算的部分為 null。
 */
public record SkillMetrics(
        String skillId,
        Variety variety,
        Consistency consistency
) {
    /**
     * 本週期完成次數在技能所屬任務間的分散程度。
     *
     * @param score  正規化熵值，範圍 [0, 1]
     * @param rating good / fair / low / none
     */
    public record Variety(
            double score,
            String rating,
            int missionsCompleted,
            int missionsAssigned,
            long totalCompletions
    ) {}

    /**
     * 最近已結算且有目標的週期命中率；沒有歷史時改看目前週期。
     *
     * @param rating excellent / good / needs work / poor
     */
    public record Consistency(
            double score,
            String rating,
            int cyclesHit,
            int cyclesCounted
    ) {}
}
