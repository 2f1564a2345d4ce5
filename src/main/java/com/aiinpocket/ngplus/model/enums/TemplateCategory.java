package com.aiinpocket.ngplus.model.enums;

import com.aiinpocket.ngplus.exception.InvalidInputException;

import java.util.Locale;

public enum TemplateCategory {

    WRITING,
    FITNESS,
    CODING,
    LEARNING,
    CREATIVITY,
    HEALTH,
    PRODUCTIVITY,
    CUSTOM;

    /** null 或空白視為 CUSTOM */
    public static TemplateCategory parse(String value) {
        if (value == null || value.isBlank()) {
            return CUSTOM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unrecognized template category: " + value);
        }
    }
}
