package com.aiinpocket.ngplus.model.dto;

import com.aiinpocket.ngplus.model.enums.PatternKind;
import com.aiinpocket.ngplus.model.enums.SuggestionPriority;

import java.time.Instant;

/**
 * 排序後的導航建議。不落地，只快取供顯示。
 */
public record Suggestion(
        String id,
        PatternKind kind,
        SuggestionPriority priority,
        double confidence,
        String title,
        String message,
        String actionHint,
        Instant relevantAt
) {}
