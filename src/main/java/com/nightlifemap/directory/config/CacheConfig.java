package com.nightlifemap.directory.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring Cache configuration using Caffeine as the cache provider.
 *
 * Holds the zone listings and the dashboard aggregate served by GridQueryService.
 * Placements evict both explicitly, so the expiry is only a backstop.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String ZONE_VENUES_CACHE = "zoneVenues";
    public static final String GRID_DASHBOARD_CACHE = "gridDashboard";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(ZONE_VENUES_CACHE, GRID_DASHBOARD_CACHE);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(500) // one entry per zone plus the dashboard
                .recordStats());
        return cacheManager;
    }
}
