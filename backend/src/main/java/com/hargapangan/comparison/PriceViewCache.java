package com.hargapangan.comparison;

import com.hargapangan.config.CaffeineConfig;
import com.hargapangan.domain.PriceLedgerChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Cache for derived price views (comparison, statistics, history, current prices), backed by the
 * Caffeine caches in {@link CaffeineConfig}. Entries expire after their TTL; any ledger change drops all of them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PriceViewCache {

    private final CacheManager cacheManager;

    /**
     * Cached value for (cacheName, key), computing and storing it on a miss. Null results are not cached.
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String cacheName, Object key, Supplier<T> loader) {
        Cache cache = cacheManager.getCache(cacheName);
        if (cache == null) {
            return loader.get();
        }
        Cache.ValueWrapper hit = cache.get(key);
        if (hit != null) {
            return (T) hit.get();
        }
        T value = loader.get();
        if (value != null) {
            cache.put(key, value);
        }
        return value;
    }

    public void invalidateAll() {
        for (String name : CaffeineConfig.PRICE_VIEW_CACHES) {
            Cache cache = cacheManager.getCache(name);
            if (cache != null) {
                cache.clear();
            }
        }
        log.debug("Price view caches cleared");
    }

    @EventListener
    public void onLedgerChanged(PriceLedgerChangedEvent event) {
        log.debug("Ledger changed for {} ({}); clearing price views", event.date(), event.reason());
        invalidateAll();
    }
}
