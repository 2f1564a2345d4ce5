package com.aiinpocket.ngplus.model.dto;

import com.aiinpocket.ngplus.model.entity.Goal;

/**
 * 單次進度更新結果。{@code milestoneHit} 為本次跨過的最高里程碑，沒有則為 null。
 */
public record GoalProgress(
        Goal goal,
        boolean justCompleted,
        Long milestoneHit,
        double progressPercentage
) {}
