package com.aiinpocket.ngplus.model.enums;

public enum GoalStatus {
    ACTIVE,
    COMPLETED,
    ARCHIVED
}
