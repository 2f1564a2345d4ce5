package com.aiinpocket.ngplus.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 綁定 application.yml 中 {@code ngplus.*} 區塊的引擎參數。
 * 獎勵倍率固定寫在 {@code ProgressionCalculator}，不開放設定。
 */
@ConfigurationProperties(prefix = "ngplus")
public record ProgressionProperties(
        String zone,
        int defaultDayStartHour,
        Long randomSeed,
        CycleParams cycle,
        ReflectionParams reflection,
        NavigatorParams navigator
) {
    public record CycleParams(
            int readinessThreshold,
            int defaultCustomIntervalDays,
            boolean revealTarget
    ) {}

    public record ReflectionParams(
            double probability,
            int maxPerDay,
            int maxPerSkillCycle
    ) {}

    public record NavigatorParams(
            int maxSuggestions,
            int imbalanceGap,
            int imbalanceFullGap,
            int cycleWindow,
            int cycleMinSamples,
            double underperformanceHitRate,
            double lapseCadenceMultiplier,
            int focusMin,
            int focusMax,
            int noRewardsCoinFloor,
            int hoardingMultiple,
            int redemptionLookbackDays,
            int difficultySampleSize,
            int difficultyMinSamples,
            int difficultyLookbackDays,
            double difficultySkewShare
    ) {}

    /** 與預設 application.yml 相同的數值 */
    public static ProgressionProperties defaults() {
        return new ProgressionProperties(
                "UTC",
                0,
                null,
                new CycleParams(8, 3, false),
                new ReflectionParams(0.10, 2, 7),
                new NavigatorParams(3, 3, 5, 5, 2, 0.4, 2.0, 1, 2, 50, 3, 30, 20, 5, 30, 0.7)
        );
    }
}
