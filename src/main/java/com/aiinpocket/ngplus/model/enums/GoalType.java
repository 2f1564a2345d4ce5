package com.aiinpocket.ngplus.model.enums;

import com.aiinpocket.ngplus.exception.InvalidInputException;

import java.util.Locale;

/**
 * 目標的衡量方式。除 {@link #CUSTOM} 外皆由引擎狀態重新計算。
 */
public enum GoalType {

    /** 目標建立後的完成次數，可限定單一技能 */
    MISSION_COUNT,
    /** 連結技能的等級 */
    SKILL_LEVEL,
    PLAYER_LEVEL,
    /** 目前金幣餘額 */
    COIN_TARGET,
    /** 目前連續天數，連結技能或整體 */
    STREAK,
    /** 手動回報進度 */
    CUSTOM;

    public static GoalType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException("Goal type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unrecognized goal type: " + value);
        }
    }
}
