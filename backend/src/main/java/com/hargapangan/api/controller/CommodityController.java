package com.hargapangan.api.controller;

import com.hargapangan.api.dto.CommodityRequest;
import com.hargapangan.api.dto.CommodityResponse;
import com.hargapangan.api.security.ActorResolver;
import com.hargapangan.domain.CommodityCategory;
import com.hargapangan.ingestion.registry.CommodityAdminService;
import com.hargapangan.ingestion.registry.CommodityAdminService.CommodityCommand;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * National commodity registry. Reads are public; writes need the admin role.
 */
@RestController
@RequestMapping("/api/v1/commodities")
@RequiredArgsConstructor
public class CommodityController {

    private final CommodityAdminService commodityAdminService;
    private final ActorResolver actorResolver;

    @GetMapping
    public ResponseEntity<List<CommodityResponse>> list(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Boolean active,
            @RequestParam(required = false) String search
    ) {
        return ResponseEntity.ok(commodityAdminService.list(CommodityCategory.fromCode(category), active, search).stream()
                .map(CommodityResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<CommodityResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(CommodityResponse.from(commodityAdminService.get(id)));
    }

    @PostMapping
    public ResponseEntity<CommodityResponse> create(@Valid @RequestBody CommodityRequest request, ServerHttpRequest httpRequest) {
        return ResponseEntity.status(HttpStatus.CREATED).body(CommodityResponse.from(
                commodityAdminService.create(toCommand(request), actorResolver.requireAdmin(httpRequest))));
    }

    @PutMapping("/{id}")
    public ResponseEntity<CommodityResponse> update(@PathVariable String id, @Valid @RequestBody CommodityRequest request,
                                                    ServerHttpRequest httpRequest) {
        return ResponseEntity.ok(CommodityResponse.from(
                commodityAdminService.update(id, toCommand(request), actorResolver.requireAdmin(httpRequest))));
    }

    /** Soft delete: the commodity is deactivated, its ledger rows stay. */
    @DeleteMapping("/{id}")
    public ResponseEntity<CommodityResponse> delete(@PathVariable String id, ServerHttpRequest httpRequest) {
        return ResponseEntity.ok(CommodityResponse.from(
                commodityAdminService.deactivate(id, actorResolver.requireAdmin(httpRequest))));
    }

    private static CommodityCommand toCommand(CommodityRequest request) {
        return new CommodityCommand(request.externalId(), request.name(), request.unit(),
                CommodityCategory.fromCode(request.category()), request.iconUrl());
    }
}
