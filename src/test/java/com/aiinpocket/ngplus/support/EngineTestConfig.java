package com.aiinpocket.ngplus.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;

import java.time.Instant;

/**
 * JPA 切片測試用的時鐘、亂數與 JSON Bean。時鐘起始於 2026-03-04（週三）12:00 UTC，
 * 除非測試另行設定，每次反思擲骰皆中獎。
 */
@TestConfiguration
public class EngineTestConfig {

    public static final Instant START = Instant.parse("2026-03-04T12:00:00Z");

    @Bean
    public MutableClock engineClock() {
        return new MutableClock(START);
    }

    @Bean
    public FixedRandom engineRandom() {
        return new FixedRandom(0.0);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public CacheManager cacheManager() {
        return new ConcurrentMapCacheManager();
    }
}
