package com.nightlifemap.directory.service;

import com.nightlifemap.directory.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Evicts cached grid views after a placement changed positions.
 * Failures are logged and swallowed; the placement outcome is already decided.
 */
@Component
public class GridCacheInvalidator {

    private static final Logger logger = LoggerFactory.getLogger(GridCacheInvalidator.class);

    private final CacheManager cacheManager;

    @Autowired
    public GridCacheInvalidator(CacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    public void zonesChanged(Collection<String> zones) {
        Set<String> distinctZones = new LinkedHashSet<>();
        zones.stream().filter(Objects::nonNull).forEach(distinctZones::add);

        for (String zone : distinctZones) {
            try {
                Cache cache = cacheManager.getCache(CacheConfig.ZONE_VENUES_CACHE);
                if (cache != null) {
                    cache.evict(zone);
                }
            } catch (RuntimeException e) {
                logger.warn("Failed to evict zone listing cache for {}: {}", zone, e.getMessage());
            }
        }

        try {
            Cache dashboard = cacheManager.getCache(CacheConfig.GRID_DASHBOARD_CACHE);
            if (dashboard != null) {
                dashboard.clear();
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to clear grid dashboard cache: {}", e.getMessage());
        }

        logger.debug("Invalidated grid caches for zones {}", distinctZones);
    }
}
