package com.aiinpocket.ngplus.model.enums;

/**
 * 時光膠囊的解鎖方式。
 */
public enum UnlockType {

    /** params: {"date": "2026-12-31"} 或 ISO 時間 */
    DATE,

    /** params: {"missionId": "..."} */
    MISSION_COMPLETION,

    /** params: {"skillId": "...", "level": 10} */
    SKILL_LEVEL,

    /** params: {"level": 10} */
    PLAYER_LEVEL
}
