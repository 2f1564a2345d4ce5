package com.aiinpocket.ngplus.service.navigator;

import com.aiinpocket.ngplus.model.enums.PatternKind;

import java.time.Instant;

/**
 * 排序前的偵測器原始輸出。
 *
 * @param subject    模式的對象（技能 id、"focus" 等），與種類組成建議 id
 * @param relevantAt 最新佐證的時間，可為 null
 */
public record DetectedPattern(
        PatternKind kind,
        String subject,
        double confidence,
        String message,
        Instant relevantAt
) {}
