package com.hargapangan.api.controller;

import com.hargapangan.api.dto.MarketPriceResponse;
import com.hargapangan.api.dto.PageResponse;
import com.hargapangan.api.dto.VerificationRequest;
import com.hargapangan.api.security.ActorResolver;
import com.hargapangan.domain.MarketPriceFilter;
import com.hargapangan.domain.MarketPriceReport;
import com.hargapangan.market.CommodityRefResolver;
import com.hargapangan.market.CsvImportResult;
import com.hargapangan.market.MarketPriceCsvImporter;
import com.hargapangan.market.MarketPriceService;
import com.hargapangan.market.MarketPriceStats;
import com.hargapangan.market.MarketPriceSubmission;
import com.hargapangan.market.MarketPriceUpdate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebInputException;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Field market price reports: submit, search, edit, verify, delete, CSV import and summary stats.
 */
@RestController
@RequestMapping("/api/v1/market-prices")
@RequiredArgsConstructor
public class MarketPriceController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv");

    private final MarketPriceService marketPriceService;
    private final MarketPriceCsvImporter marketPriceCsvImporter;
    private final CommodityRefResolver commodityRefResolver;
    private final ActorResolver actorResolver;

    @GetMapping
    public ResponseEntity<PageResponse<MarketPriceResponse>> search(
            @RequestParam(required = false) String marketType,
            @RequestParam(required = false) String qualityGrade,
            @RequestParam(required = false) String verificationStatus,
            @RequestParam(required = false) String entrySource,
            @RequestParam(required = false) String commodityId,
            @RequestParam(required = false) String provinceName,
            @RequestParam(required = false) String cityName,
            @RequestParam(required = false) String marketName,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "20") int size
    ) {
        MarketPriceFilter filter = new MarketPriceFilter(
                parse(MarketPriceReport.MarketType.class, marketType),
                parse(MarketPriceReport.QualityGrade.class, qualityGrade),
                parse(MarketPriceReport.VerificationStatus.class, verificationStatus),
                parse(MarketPriceReport.EntrySource.class, entrySource),
                commodityId, provinceName, cityName, marketName, from, to);
        return ResponseEntity.ok(PageResponse.of(marketPriceService.search(filter, page, size), this::toResponse));
    }

    @GetMapping("/stats")
    public ResponseEntity<MarketPriceStats> stats() {
        return ResponseEntity.ok(marketPriceService.stats());
    }

    @GetMapping("/{id}")
    public ResponseEntity<MarketPriceResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(marketPriceService.get(id)));
    }

    @PostMapping
    public ResponseEntity<MarketPriceResponse> submit(@RequestBody MarketPriceSubmission request, ServerHttpRequest httpRequest) {
        MarketPriceReport saved = marketPriceService.submit(request, actorResolver.requireUser(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(saved));
    }

    @PutMapping("/{id}")
    public ResponseEntity<MarketPriceResponse> update(@PathVariable String id, @RequestBody MarketPriceUpdate request,
                                                      ServerHttpRequest httpRequest) {
        return ResponseEntity.ok(toResponse(marketPriceService.update(id, request, actorResolver.requireUser(httpRequest))));
    }

    @PatchMapping("/{id}/verification")
    public ResponseEntity<MarketPriceResponse> verify(@PathVariable String id, @Valid @RequestBody VerificationRequest request,
                                                      ServerHttpRequest httpRequest) {
        return ResponseEntity.ok(toResponse(marketPriceService.verify(id, request.status(), actorResolver.requireAdmin(httpRequest))));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id, ServerHttpRequest httpRequest) {
        marketPriceService.delete(id, actorResolver.requireUser(httpRequest));
        return ResponseEntity.noContent().build();
    }

    /** Body is the CSV text itself (UTF-8, optional BOM, header row required). */
    @PostMapping(value = "/import", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<CsvImportResult> importCsv(@RequestBody String csv, ServerHttpRequest httpRequest) {
        return ResponseEntity.ok(marketPriceCsvImporter.importCsv(csv, actorResolver.requireEditor(httpRequest)));
    }

    @GetMapping("/import/template")
    public ResponseEntity<String> template() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"market-price-template.csv\"")
                .contentType(TEXT_CSV)
                .body(marketPriceCsvImporter.template());
    }

    private MarketPriceResponse toResponse(MarketPriceReport report) {
        return MarketPriceResponse.from(report,
                report.getCommodityId() != null ? commodityRefResolver.resolve(report.getCommodity()).orElse(null) : null);
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ServerWebInputException("Unknown " + type.getSimpleName() + ": " + value);
        }
    }
}
