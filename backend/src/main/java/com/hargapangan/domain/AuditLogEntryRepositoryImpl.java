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

import java.time.Instant;
import java.util.List;

/**
 * Implementation of AuditLogEntryRepositoryCustom using MongoTemplate.
 */
@Repository
@RequiredArgsConstructor
public class AuditLogEntryRepositoryImpl implements AuditLogEntryRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Page<AuditLogEntry> search(String action, String entityType, String actorId, Instant from, Instant to,
                                      Pageable pageable) {
        Criteria criteria = new Criteria();
        if (action != null && !action.isBlank()) {
            criteria = criteria.and("action").is(action);
        }
        if (entityType != null && !entityType.isBlank()) {
            criteria = criteria.and("entityType").is(entityType);
        }
        if (actorId != null && !actorId.isBlank()) {
            criteria = criteria.and("actorId").is(actorId);
        }
        if (from != null || to != null) {
            Criteria created = criteria.and("createdAt");
            if (from != null) {
                created = created.gte(from);
            }
            if (to != null) {
                created.lte(to);
            }
        }
        Query query = Query.query(criteria);
        long total = mongoTemplate.count(query, AuditLogEntry.class);
        query.with(Sort.by(Sort.Direction.DESC, "createdAt")).with(pageable);
        List<AuditLogEntry> content = mongoTemplate.find(query, AuditLogEntry.class);
        return new PageImpl<>(content, pageable, total);
    }
}
