package com.aiinpocket.ngplus.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 快取設定。
 * Caffeine 本地快取，存放最新的導航建議（僅供顯示，TTL 10 分鐘）。
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String NAVIGATOR_CACHE = "navigatorSuggestions";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(NAVIGATOR_CACHE);
        manager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(10));
        return manager;
    }
}
