package com.hargapangan.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for commodities. Lookup by upstream id drives the registry find-or-create.
 */
public interface CommodityRepository extends MongoRepository<Commodity, String> {

    Optional<Commodity> findByExternalId(Integer externalId);

    List<Commodity> findByIdIn(Collection<String> ids);

    List<Commodity> findByActiveTrueOrderByNameAsc();
}
