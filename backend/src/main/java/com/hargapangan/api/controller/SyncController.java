package com.hargapangan.api.controller;

import com.hargapangan.api.dto.SyncTriggerRequest;
import com.hargapangan.api.security.ActorResolver;
import com.hargapangan.audit.Actor;
import com.hargapangan.ingestion.job.PriceSyncJob;
import com.hargapangan.ingestion.job.SyncCycleResult;
import com.hargapangan.ingestion.job.SyncOptions;
import com.hargapangan.ingestion.job.SyncStatusView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /sync/trigger runs one sync cycle (admin only, 409 while a cycle is running) on a bounded-elastic
 * worker, never on the event loop. GET /sync/status reports the scheduler state.
 */
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
public class SyncController {

    private final PriceSyncJob priceSyncJob;
    private final ActorResolver actorResolver;

    @PostMapping("/trigger")
    public Mono<ResponseEntity<SyncCycleResult>> trigger(@RequestBody(required = false) SyncTriggerRequest request,
                                                         ServerHttpRequest httpRequest) {
        Actor actor = actorResolver.requireAdmin(httpRequest);
        SyncOptions defaults = priceSyncJob.defaultOptions();
        SyncOptions options = request == null ? defaults
                : defaults.with(request.provinceId(), request.cityId(), request.levelHargaId(), request.syncRegions());
        return Mono.fromCallable(() -> priceSyncJob.triggerNow(options, actor))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> result.success() ? ResponseEntity.ok(result) : ResponseEntity.status(502).body(result));
    }

    @GetMapping("/status")
    public ResponseEntity<SyncStatusView> status() {
        return ResponseEntity.ok(priceSyncJob.status());
    }
}
