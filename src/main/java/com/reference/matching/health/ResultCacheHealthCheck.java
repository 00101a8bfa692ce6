package com.reference.matching.health;

import com.reference.matching.cache.CacheStats;
import com.reference.matching.cache.ResultCache;
import com.reference.matching.cache.StoreCacheRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports DEGRADED when a store cache dropped unreadable entries on load.
 * The engine keeps working; affected references are simply fetched again.
 */
public class ResultCacheHealthCheck implements HealthCheck {

    static final String NAME = "resultCache";

    private final StoreCacheRegistry registry;

    public ResultCacheHealthCheck(StoreCacheRegistry registry) {
        this.registry = registry;
    }

    @Override
    public ComponentHealth check() {
        if (!registry.getConfig().enabled()) {
            return ComponentHealth.operational(NAME, "Caching disabled", Map.of());
        }

        int warnings = 0;
        long entries = 0;
        List<String> affected = new ArrayList<>();
        List<ResultCache> caches = List.copyOf(registry.openCaches());
        for (ResultCache cache : caches) {
            CacheStats stats = cache.getStats();
            entries += stats.size();
            if (stats.loadWarnings() > 0) {
                warnings += stats.loadWarnings();
                affected.add(cache.getStoreId());
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("stores", caches.size());
        details.put("entries", entries);
        details.put("loadWarnings", warnings);
        if (warnings > 0) {
            return ComponentHealth.degraded(NAME,
                    warnings + " unreadable entries dropped in: " + String.join(", ", affected), details);
        }
        return ComponentHealth.operational(NAME, caches.size() + " store caches loaded", details);
    }
}
