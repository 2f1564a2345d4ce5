package com.aiinpocket.ngplus.model.enums;

/**
 * 技能週期狀態。由技能的週期欄位與目前時間推導，不儲存。
 */
public enum CycleState {

    /** 週期已開啟，但開始時任務數未達門檻，沒有目標 */
    NOT_READY,

    /** 週期已開啟且已抽出目標 */
    ACTIVE,

    /** 尚無週期，或已過 cycleEnd 但尚未輪替 */
    AWAITING_ROLLOVER
}
