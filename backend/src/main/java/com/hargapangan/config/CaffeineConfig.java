package com.hargapangan.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches for derived price views. Every cache listed in
 * {@link #PRICE_VIEW_CACHES} is dropped when the ledger changes.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String CURRENT_PRICES_CACHE = "currentPricesCache";
    public static final String COMPARISON_CACHE = "comparisonCache";
    public static final String STATISTICS_CACHE = "statisticsCache";
    public static final String HISTORY_CACHE = "historyCache";
    public static final String REGION_CACHE = "regionCache";

    public static final List<String> PRICE_VIEW_CACHES =
            List.of(CURRENT_PRICES_CACHE, COMPARISON_CACHE, STATISTICS_CACHE, HISTORY_CACHE);

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(CURRENT_PRICES_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(500)
                .build());
        manager.registerCustomCache(COMPARISON_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(200)
                .build());
        manager.registerCustomCache(STATISTICS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(50)
                .build());
        manager.registerCustomCache(HISTORY_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(2_000)
                .build());
        manager.registerCustomCache(REGION_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(100)
                .build());
        return manager;
    }
}
