package com.hargapangan.audit;

import com.hargapangan.domain.AuditLogEntry;
import com.hargapangan.domain.AuditLogEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit trail. Entries are inserted and queried, never updated or deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    private static final int MAX_PAGE_SIZE = 200;

    private final AuditLogEntryRepository repository;
    private final Clock clock;

    public AuditLogEntry record(Actor actor, String action, String entityType, String entityId,
                                Map<String, Object> oldValues, Map<String, Object> newValues) {
        AuditLogEntry entry = new AuditLogEntry();
        entry.setActorId(actor != null ? actor.id() : AuditActions.SYSTEM_ACTOR);
        entry.setAction(action);
        entry.setEntityType(entityType);
        entry.setEntityId(entityId);
        entry.setOldValues(oldValues);
        entry.setNewValues(newValues);
        if (actor != null) {
            entry.setIpAddress(actor.ipAddress());
            entry.setUserAgent(actor.userAgent());
        }
        entry.setCreatedAt(Instant.now(clock));
        AuditLogEntry saved = repository.insert(entry);
        log.debug("Audit {} {} {} by {}", action, entityType, entityId, entry.getActorId());
        return saved;
    }

    public Page<AuditLogEntry> search(String action, String entityType, String actorId, Instant from, Instant to,
                                      int page, int size) {
        int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return repository.search(action, entityType, actorId, from, to, PageRequest.of(Math.max(0, page), safeSize));
    }
}
