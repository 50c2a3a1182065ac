package com.hargapangan.api.dto;

import com.hargapangan.domain.AuditLogEntry;

import java.time.Instant;
import java.util.Map;

public record AuditLogResponse(String id, String actorId, String action, String entityType, String entityId,
                               Map<String, Object> oldValues, Map<String, Object> newValues,
                               String ipAddress, String userAgent, Instant createdAt) {

    public static AuditLogResponse from(AuditLogEntry e) {
        return new AuditLogResponse(e.getId(), e.getActorId(), e.getAction(), e.getEntityType(), e.getEntityId(),
                e.getOldValues(), e.getNewValues(), e.getIpAddress(), e.getUserAgent(), e.getCreatedAt());
    }
}
