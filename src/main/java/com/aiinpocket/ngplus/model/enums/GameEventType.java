package com.aiinpocket.ngplus.model.enums;

/**
 * 呈現層事件動態（{@code GameEventLog}）的類型。
 */
public enum GameEventType {

    PLAYER_LEVEL_UP,
    SKILL_LEVEL_UP,
    CYCLE_BONUS,
    REFLECTION_TOKEN,
    CAPSULE_UNLOCKED,
    REWARD_REDEEMED,
    GOAL_MILESTONE,
    GOAL_COMPLETED
}
