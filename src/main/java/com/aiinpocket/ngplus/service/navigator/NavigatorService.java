package com.aiinpocket.ngplus.service.navigator;

import com.aiinpocket.ngplus.config.CacheConfig;
import com.aiinpocket.ngplus.model.dto.Suggestion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 導航建議的入口。結果只快取供顯示，
 * 引擎不會讀回。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NavigatorService {

    static final String CACHE_KEY = "current";

    private final NavigatorSnapshotLoader snapshotLoader;
    private final NavigatorEngine engine;
    private final CacheManager cacheManager;

    @Cacheable(value = CacheConfig.NAVIGATOR_CACHE, key = "'" + CACHE_KEY + "'")
    public List<Suggestion> currentSuggestions() {
        return analyzeNow();
    }

    /** 重新分析並取代快取結果 */
    public List<Suggestion> refresh() {
        List<Suggestion> suggestions = analyzeNow();
        Cache cache = cacheManager.getCache(CacheConfig.NAVIGATOR_CACHE);
        if (cache != null) {
            cache.put(CACHE_KEY, suggestions);
        }
        return suggestions;
    }

    @CacheEvict(value = CacheConfig.NAVIGATOR_CACHE, allEntries = true)
    public void invalidate() {
        log.debug("[導航] 快取已清除");
    }

    public List<Suggestion> analyzeNow() {
        List<Suggestion> suggestions = engine.analyze(snapshotLoader.load());
        log.info("[導航] 分析產生 {} 則建議: {}", suggestions.size(),
                suggestions.stream().map(Suggestion::kind).toList());
        return suggestions;
    }
}
