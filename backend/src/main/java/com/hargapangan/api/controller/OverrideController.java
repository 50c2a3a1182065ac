package com.hargapangan.api.controller;

import com.hargapangan.api.dto.OverrideCreateRequest;
import com.hargapangan.api.dto.OverrideDecisionRequest;
import com.hargapangan.api.dto.OverrideResponse;
import com.hargapangan.api.dto.PageResponse;
import com.hargapangan.api.security.ActorResolver;
import com.hargapangan.audit.Actor;
import com.hargapangan.domain.PriceOverride;
import com.hargapangan.override.OverrideRequest;
import com.hargapangan.override.OverrideService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Manual price overrides. Editors and admins create; only admins decide or delete.
 */
@RestController
@RequestMapping("/api/v1/overrides")
@RequiredArgsConstructor
public class OverrideController {

    private final OverrideService overrideService;
    private final ActorResolver actorResolver;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<PageResponse<OverrideResponse>> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String commodityId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(PageResponse.of(
                overrideService.list(parseStatus(status), commodityId, from, to, page, size), OverrideResponse::from));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OverrideResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(OverrideResponse.from(overrideService.get(id)));
    }

    @PostMapping
    public ResponseEntity<OverrideResponse> create(@Valid @RequestBody OverrideCreateRequest request,
                                                   ServerHttpRequest httpRequest) {
        Actor actor = actorResolver.requireEditor(httpRequest);
        LocalDate date = request.date() != null ? request.date() : LocalDate.now(clock);
        PriceOverride created = overrideService.create(new OverrideRequest(
                request.commodityId(), date, blankToNull(request.regionId()), request.requestedPrice(),
                request.reason(), request.sourceInfo(), request.evidenceRef()), actor);
        HttpStatus status = created.getStatus() == PriceOverride.Status.PENDING ? HttpStatus.ACCEPTED : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(OverrideResponse.from(created));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<OverrideResponse> decide(@PathVariable String id,
                                                   @Valid @RequestBody OverrideDecisionRequest request,
                                                   ServerHttpRequest httpRequest) {
        Actor actor = actorResolver.requireAdmin(httpRequest);
        return ResponseEntity.ok(OverrideResponse.from(
                overrideService.decide(id, request.status(), request.rejectionReason(), actor)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id, ServerHttpRequest httpRequest) {
        overrideService.delete(id, actorResolver.requireAdmin(httpRequest));
        return ResponseEntity.noContent().build();
    }

    private static PriceOverride.Status parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return PriceOverride.Status.valueOf(status.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ServerWebInputException("Unknown override status: " + status);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
