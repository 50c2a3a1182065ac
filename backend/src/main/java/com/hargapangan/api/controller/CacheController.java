package com.hargapangan.api.controller;

import com.hargapangan.api.security.ActorResolver;
import com.hargapangan.audit.Actor;
import com.hargapangan.audit.AuditActions;
import com.hargapangan.audit.AuditLogService;
import com.hargapangan.comparison.PriceViewCache;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
public class CacheController {

    private final PriceViewCache priceViewCache;
    private final AuditLogService auditLogService;
    private final ActorResolver actorResolver;

    /** Drops every cached price view (current, comparison, statistics, history). */
    @PostMapping("/invalidate")
    public ResponseEntity<Map<String, String>> invalidate(ServerHttpRequest httpRequest) {
        Actor actor = actorResolver.requireAdmin(httpRequest);
        priceViewCache.invalidateAll();
        auditLogService.record(actor, AuditActions.CACHE_INVALIDATED, "cache", "price_views", null, null);
        return ResponseEntity.ok(Map.of("message", "Price caches invalidated"));
    }
}
