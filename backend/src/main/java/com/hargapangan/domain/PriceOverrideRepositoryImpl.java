package com.hargapangan.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Implementation of PriceOverrideRepositoryCustom using MongoTemplate.
 */
@Repository
@RequiredArgsConstructor
public class PriceOverrideRepositoryImpl implements PriceOverrideRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Page<PriceOverride> search(PriceOverride.Status status, String commodityId, LocalDate from, LocalDate to,
                                      Pageable pageable) {
        Criteria criteria = new Criteria();
        if (status != null) {
            criteria = criteria.and("status").is(status);
        }
        if (commodityId != null && !commodityId.isBlank()) {
            criteria = criteria.and("commodityId").is(commodityId);
        }
        if (from != null || to != null) {
            Criteria date = criteria.and("date");
            if (from != null) {
                date = date.gte(from);
            }
            if (to != null) {
                date.lte(to);
            }
        }
        Query query = Query.query(criteria);
        long total = mongoTemplate.count(query, PriceOverride.class);
        query.with(Sort.by(Sort.Direction.DESC, "createdAt")).with(pageable);
        List<PriceOverride> content = mongoTemplate.find(query, PriceOverride.class);
        return new PageImpl<>(content, pageable, total);
    }
}
