package com.hargapangan.api.controller;

import com.hargapangan.comparison.CurrentPricePage;
import com.hargapangan.comparison.DayComparisonRow;
import com.hargapangan.comparison.PriceComparisonService;
import com.hargapangan.comparison.PriceExportService;
import com.hargapangan.comparison.PriceHistory;
import com.hargapangan.comparison.PriceStatistics;
import com.hargapangan.comparison.TopMover;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Read side of the price ledger: current prices, history, day comparison, statistics, top movers, CSV export.
 */
@RestController
@RequestMapping("/api/v1/prices")
@RequiredArgsConstructor
public class PriceController {

    private final PriceComparisonService priceComparisonService;
    private final PriceExportService priceExportService;

    @GetMapping("/current")
    public ResponseEntity<CurrentPricePage> current(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String regionId,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String search,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "50") int size
    ) {
        return ResponseEntity.ok(priceComparisonService.currentPrices(date, regionId, category, search, page, size));
    }

    @GetMapping("/history/{commodityId}")
    public ResponseEntity<PriceHistory> history(
            @PathVariable String commodityId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) String regionId
    ) {
        return ResponseEntity.ok(priceComparisonService.dayOverDay(commodityId, from, to, regionId));
    }

    @GetMapping("/comparison")
    public ResponseEntity<List<DayComparisonRow>> comparison(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(priceComparisonService.compareDay(date != null ? date : priceComparisonService.today()));
    }

    @GetMapping("/statistics")
    public ResponseEntity<PriceStatistics> statistics(
            @RequestParam(required = false, defaultValue = "7d") String period,
            @RequestParam(required = false) String regionId
    ) {
        return ResponseEntity.ok(priceComparisonService.statistics(period, regionId));
    }

    @GetMapping("/top-movers")
    public ResponseEntity<List<TopMover>> topMovers(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false, defaultValue = "10") int limit
    ) {
        return ResponseEntity.ok(priceComparisonService.topMovers(start, end, limit));
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        LocalDate end = to != null ? to : priceComparisonService.today();
        LocalDate start = from != null ? from : end.minusDays(30);
        String csv = priceExportService.exportCsv(start, end);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"harga-pangan-" + start + "-" + end + ".csv\"")
                .contentType(new MediaType("text", "csv"))
                .body(csv);
    }
}
