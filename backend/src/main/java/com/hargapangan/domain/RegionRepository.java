package com.hargapangan.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for regions.
 */
public interface RegionRepository extends MongoRepository<Region, String> {

    Optional<Region> findByProvinceIdAndCityIdAndLevel(Integer provinceId, Integer cityId, Region.Level level);

    List<Region> findByLevelOrderByProvinceNameAsc(Region.Level level);

    List<Region> findByProvinceIdAndLevelOrderByCityNameAsc(Integer provinceId, Region.Level level);

    List<Region> findAllByOrderByProvinceNameAscCityNameAsc();
}
