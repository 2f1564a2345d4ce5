package com.aiinpocket.ngplus.model.enums;

import lombok.Getter;

/**
 * 導航模式種類。宣告順序即偵測器執行順序，
 * 也是建議排序的最後比較依據。
 */
@Getter
public enum PatternKind {

    SKILL_IMBALANCE("Skill Balance", "Consider creating missions for your other skills"),
    CYCLE_UNDERPERFORMANCE("Cycle Targets", "Try to complete a variety of missions for each skill"),
    READINESS_GAP("Needs Missions", "Each skill needs enough missions to be cycle-ready"),
    REFLECTION_LAPSE("Time to Reflect", "Open the journal to write a new entry"),
    FOCUS_SATURATION("Focus", "Keep one or two skills in Focus for deeper mastery"),
    COIN_HOARDING("Rewards", "Define a reward or treat yourself to one"),
    DIFFICULTY_SKEW("Difficulty Mix", "Mix in missions of other difficulties");

    private final String title;
    private final String actionHint;

    PatternKind(String title, String actionHint) {
        this.title = title;
        this.actionHint = actionHint;
    }
}
