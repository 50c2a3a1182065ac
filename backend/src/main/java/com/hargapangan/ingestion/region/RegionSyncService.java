package com.hargapangan.ingestion.region;

import com.hargapangan.config.CaffeineConfig;
import com.hargapangan.domain.Region;
import com.hargapangan.domain.RegionRepository;
import com.hargapangan.ingestion.adapter.PriceInformationClient;
import com.hargapangan.ingestion.adapter.RegionSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Region registry fed from the upstream province and city lists. Sync failures are logged and
 * never propagate to the price cycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegionSyncService {

    private final PriceInformationClient client;
    private final RegionRepository repository;
    private final Clock clock;

    /**
     * Find-or-create a province row for every upstream province.
     *
     * @return number of rows created; 0 when the upstream failed
     */
    @CacheEvict(cacheNames = CaffeineConfig.REGION_CACHE, allEntries = true)
    public int syncProvinces() {
        List<RegionSnapshot> provinces;
        try {
            provinces = client.fetchProvinces();
        } catch (Exception e) {
            log.warn("Province sync skipped: {}", e.getMessage());
            return 0;
        }
        if (provinces.isEmpty()) {
            log.warn("No provinces received from upstream");
            return 0;
        }
        int created = 0;
        for (RegionSnapshot p : provinces) {
            if (p.id() == null) {
                continue;
            }
            try {
                if (upsert(p.id(), p.name(), null, null, Region.Level.PROVINCE)) {
                    created++;
                }
            } catch (Exception e) {
                log.error("Error syncing province {}: {}", p.name(), e.getMessage());
            }
        }
        log.info("Province sync done: {} received, {} created", provinces.size(), created);
        return created;
    }

    /**
     * Find-or-create city rows of one province.
     *
     * @return number of rows created; 0 when the upstream failed
     */
    @CacheEvict(cacheNames = CaffeineConfig.REGION_CACHE, allEntries = true)
    public int syncCities(int provinceId) {
        Region province = repository.findByProvinceIdAndCityIdAndLevel(provinceId, null, Region.Level.PROVINCE).orElse(null);
        List<RegionSnapshot> cities;
        try {
            cities = client.fetchCities(provinceId);
        } catch (Exception e) {
            log.warn("City sync for province {} skipped: {}", provinceId, e.getMessage());
            return 0;
        }
        int created = 0;
        for (RegionSnapshot c : cities) {
            if (c.id() == null) {
                continue;
            }
            try {
                if (upsert(provinceId, province != null ? province.getProvinceName() : null, c.id(), c.name(), Region.Level.CITY)) {
                    created++;
                }
            } catch (Exception e) {
                log.error("Error syncing city {}: {}", c.name(), e.getMessage());
            }
        }
        log.info("City sync for province {} done: {} received, {} created", provinceId, cities.size(), created);
        return created;
    }

    @Cacheable(cacheNames = CaffeineConfig.REGION_CACHE, key = "'provinces'")
    public List<Region> provinces() {
        return repository.findByLevelOrderByProvinceNameAsc(Region.Level.PROVINCE);
    }

    @Cacheable(cacheNames = CaffeineConfig.REGION_CACHE, key = "'cities-' + #provinceId")
    public List<Region> cities(int provinceId) {
        return repository.findByProvinceIdAndLevelOrderByCityNameAsc(provinceId, Region.Level.CITY);
    }

    public List<Region> all() {
        return repository.findAllByOrderByProvinceNameAscCityNameAsc();
    }

    private boolean upsert(Integer provinceId, String provinceName, Integer cityId, String cityName, Region.Level level) {
        if (repository.findByProvinceIdAndCityIdAndLevel(provinceId, cityId, level).isPresent()) {
            return false;
        }
        Region r = new Region();
        r.setProvinceId(provinceId);
        r.setProvinceName(provinceName);
        r.setCityId(cityId);
        r.setCityName(cityName);
        r.setLevel(level);
        Instant now = Instant.now(clock);
        r.setCreatedAt(now);
        r.setUpdatedAt(now);
        try {
            repository.insert(r);
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }
}
