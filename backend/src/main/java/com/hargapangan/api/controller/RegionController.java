package com.hargapangan.api.controller;

import com.hargapangan.api.dto.RegionResponse;
import com.hargapangan.ingestion.region.RegionSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/regions")
@RequiredArgsConstructor
public class RegionController {

    private final RegionSyncService regionSyncService;

    @GetMapping
    public ResponseEntity<List<RegionResponse>> all() {
        return ResponseEntity.ok(regionSyncService.all().stream().map(RegionResponse::from).toList());
    }

    @GetMapping("/provinces")
    public ResponseEntity<List<RegionResponse>> provinces() {
        return ResponseEntity.ok(regionSyncService.provinces().stream().map(RegionResponse::from).toList());
    }

    @GetMapping("/cities/{provinceId}")
    public ResponseEntity<List<RegionResponse>> cities(@PathVariable int provinceId) {
        return ResponseEntity.ok(regionSyncService.cities(provinceId).stream().map(RegionResponse::from).toList());
    }
}
