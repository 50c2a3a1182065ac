package com.hargapangan.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;

/**
 * Filtered audit log query.
 */
public interface AuditLogEntryRepositoryCustom {

    Page<AuditLogEntry> search(String action, String entityType, String actorId, Instant from, Instant to, Pageable pageable);
}
