package com.aiinpocket.ngplus.model.enums;

public enum SuggestionPriority {

    HIGH,
    NORMAL,
    LOW;

    /** 固定信心區間：>= 0.7 高，>= 0.4 一般，其餘為低 */
    public static SuggestionPriority forConfidence(double confidence) {
        if (confidence >= 0.7) return HIGH;
        if (confidence >= 0.4) return NORMAL;
        return LOW;
    }
}
