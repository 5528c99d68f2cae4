package com.example.starterkit.projectgen.catalog;

import com.example.starterkit.projectgen.config.GeneratorConfiguration;
import com.example.starterkit.projectgen.model.FeatureSpec;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports what the catalog cache currently holds: cached catalog locations,
 * the features each one provides and Caffeine hit/miss statistics.
 */
@Service
@RequiredArgsConstructor
public class CatalogCacheInspector {
    private final CacheManager cacheManager;

    public Map<String, Object> inspect() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cacheName", GeneratorConfiguration.CATALOG_CACHE);

        Cache cache = cacheManager.getCache(GeneratorConfiguration.CATALOG_CACHE);
        if (cache == null) {
            out.put("error", "Cache not found");
            return out;
        }

        if (cache instanceof CaffeineCache) {
            com.github.benmanes.caffeine.cache.Cache<Object, Object> nativeCache =
                    ((CaffeineCache) cache).getNativeCache();

            out.put("estimatedSize", nativeCache.estimatedSize());
            out.put("locations", nativeCache.asMap().keySet());
            out.put("catalogs", describeCatalogs(nativeCache.asMap()));

            CacheStats stats = nativeCache.stats();
            Map<String, Object> statsMap = new LinkedHashMap<>();
            statsMap.put("hitCount", stats.hitCount());
            statsMap.put("missCount", stats.missCount());
            statsMap.put("evictionCount", stats.evictionCount());
            statsMap.put("hitRate", stats.hitRate());
            out.put("stats", statsMap);
        } else {
            out.put("message", "Cache is not a CaffeineCache; native inspection unavailable");
        }
        return out;
    }

    /**
     * Per cached location: how many active features it holds, grouped by
     * module category in catalog order.
     */
    static Map<String, Object> describeCatalogs(Map<Object, Object> entries) {
        Map<String, Object> catalogs = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : entries.entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            Map<String, Integer> byCategory = new LinkedHashMap<>();
            int features = 0;
            for (Object value : ((Map<?, ?>) entry.getValue()).values()) {
                if (value instanceof FeatureSpec) {
                    features++;
                    byCategory.merge(((FeatureSpec) value).category(), 1, Integer::sum);
                }
            }
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("featureCount", features);
            summary.put("categories", byCategory);
            catalogs.put(String.valueOf(entry.getKey()), summary);
        }
        return catalogs;
    }
}
