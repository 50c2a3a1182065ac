package com.hargapangan.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for custom_commodities.
 */
public interface CustomCommodityRepository extends MongoRepository<CustomCommodity, String> {

    Optional<CustomCommodity> findFirstByNameAndUnitAndCategory(String name, String unit, String category);

    List<CustomCommodity> findByActiveTrueOrderByNameAsc();
}
