package com.hargapangan.api.controller;

import com.hargapangan.api.dto.CustomCommodityRequest;
import com.hargapangan.api.dto.CustomCommodityResponse;
import com.hargapangan.api.security.ActorResolver;
import com.hargapangan.market.CustomCommodityService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Commodities reported in the field that are not part of the national list.
 */
@RestController
@RequestMapping("/api/v1/custom-commodities")
@RequiredArgsConstructor
public class CustomCommodityController {

    private final CustomCommodityService customCommodityService;
    private final ActorResolver actorResolver;

    @GetMapping
    public ResponseEntity<List<CustomCommodityResponse>> list(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String search,
            @RequestParam(required = false, defaultValue = "false") boolean includeInactive
    ) {
        return ResponseEntity.ok(customCommodityService.list(category, search, includeInactive).stream()
                .map(CustomCommodityResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<CustomCommodityResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(CustomCommodityResponse.from(customCommodityService.get(id)));
    }

    @PostMapping
    public ResponseEntity<CustomCommodityResponse> create(@Valid @RequestBody CustomCommodityRequest request,
                                                          ServerHttpRequest httpRequest) {
        return ResponseEntity.status(HttpStatus.CREATED).body(CustomCommodityResponse.from(customCommodityService.create(
                request.name(), request.unit(), request.category(), request.description(),
                actorResolver.requireUser(httpRequest))));
    }

    @PutMapping("/{id}")
    public ResponseEntity<CustomCommodityResponse> update(@PathVariable String id,
                                                          @Valid @RequestBody CustomCommodityRequest request,
                                                          ServerHttpRequest httpRequest) {
        return ResponseEntity.ok(CustomCommodityResponse.from(customCommodityService.update(
                id, request.name(), request.unit(), request.category(), request.description(),
                actorResolver.requireEditor(httpRequest))));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<CustomCommodityResponse> delete(@PathVariable String id, ServerHttpRequest httpRequest) {
        return ResponseEntity.ok(CustomCommodityResponse.from(
                customCommodityService.deactivate(id, actorResolver.requireAdmin(httpRequest))));
    }
}
