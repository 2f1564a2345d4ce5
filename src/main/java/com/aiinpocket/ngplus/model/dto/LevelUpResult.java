package com.aiinpocket.ngplus.model.dto;

public record LevelUpResult(
        boolean leveledUp,
        int oldLevel,
        int newLevel,
        long currentXp,
        long xpToNextLevel
) {}
