package com.aiinpocket.ngplus.model.enums;

import com.aiinpocket.ngplus.exception.InvalidInputException;

import java.util.Locale;

/**
 * 技能週期的輪替頻率。
 * CUSTOM 使用技能的 {@code customIntervalDays}。
 */
public enum CycleCadence {

    DAILY,
    WEEKLY,
    MONTHLY,
    CUSTOM;

    public static CycleCadence parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException("Cadence is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unrecognized cadence: " + value);
        }
    }
}
