package com.hargapangan.api.controller;

import com.hargapangan.api.dto.AuditLogResponse;
import com.hargapangan.api.dto.PageResponse;
import com.hargapangan.api.security.ActorResolver;
import com.hargapangan.audit.AuditLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * GET /audit-logs, admin only, newest first.
 */
@RestController
@RequestMapping("/api/v1/audit-logs")
@RequiredArgsConstructor
public class AuditLogController {

    private final AuditLogService auditLogService;
    private final ActorResolver actorResolver;

    @GetMapping
    public ResponseEntity<PageResponse<AuditLogResponse>> search(
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String entityType,
            @RequestParam(required = false) String actorId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "50") int size,
            ServerHttpRequest httpRequest
    ) {
        actorResolver.requireAdmin(httpRequest);
        return ResponseEntity.ok(PageResponse.of(
                auditLogService.search(action, entityType, actorId, from, to, page, size), AuditLogResponse::from));
    }
}
