package com.hargapangan.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for audit_logs. Only inserts and reads are used; see AuditLogService.
 */
public interface AuditLogEntryRepository extends MongoRepository<AuditLogEntry, String>, AuditLogEntryRepositoryCustom {

    List<AuditLogEntry> findByEntityTypeAndEntityIdOrderByCreatedAtDesc(String entityType, String entityId);
}
