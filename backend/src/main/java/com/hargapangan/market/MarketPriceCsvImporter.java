package com.hargapangan.market;

import com.hargapangan.audit.Actor;
import com.hargapangan.audit.AuditActions;
import com.hargapangan.audit.AuditLogService;
import com.hargapangan.domain.MarketPriceReport;
import com.hargapangan.domain.MarketPriceReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Bulk import of market reports from CSV text with a header row. Each row goes through the same
 * validation as a single submission; invalid rows are skipped and reported, the batch continues.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketPriceCsvImporter {

    static final int MAX_REPORTED_ERRORS = 10;

    static final String[] TEMPLATE_HEADER = {
            "commodity_type", "commodity_id", "commodity_source", "commodity_name", "commodity_unit", "commodity_category",
            "market_name", "market_type", "market_location", "province_name", "city_name", "price", "quality_grade",
            "date_recorded", "time_recorded", "notes"
    };

    private final MarketPriceService marketPriceService;
    private final MarketPriceReportRepository repository;
    private final AuditLogService auditLogService;

    public CsvImportResult importCsv(String csvText, Actor actor) {
        if (csvText == null || csvText.isBlank()) {
            throw new MarketPriceException(MarketPriceException.VALIDATION_FAILED, "CSV body is empty");
        }
        String batchId = UUID.randomUUID().toString();
        int total = 0;
        int imported = 0;
        List<String> errors = new ArrayList<>();
        int errorCount = 0;

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .setTrim(true)
                .build();
        try (CSVParser parser = new CSVParser(new StringReader(stripBom(csvText)), format)) {
            if (!parser.getHeaderMap().containsKey("market_name")) {
                throw new MarketPriceException(MarketPriceException.VALIDATION_FAILED, "CSV header must contain market_name");
            }
            for (CSVRecord record : parser) {
                total++;
                long rowNumber = record.getRecordNumber() + 1;
                try {
                    MarketPriceSubmission submission = toSubmission(record);
                    MarketPriceReport report = marketPriceService.buildReport(submission, actor,
                            MarketPriceReport.EntrySource.IMPORT, batchId);
                    repository.save(report);
                    imported++;
                } catch (MarketPriceException | IllegalArgumentException | DateTimeParseException e) {
                    errorCount++;
                    addError(errors, rowNumber, e.getMessage());
                } catch (RuntimeException e) {
                    errorCount++;
                    log.error("CSV import {} failed to store row {}", batchId, rowNumber, e);
                    addError(errors, rowNumber, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                }
            }
        } catch (IOException | UncheckedIOException e) {
            throw new MarketPriceException(MarketPriceException.VALIDATION_FAILED, "Unreadable CSV: " + e.getMessage());
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("total", total);
        details.put("imported", imported);
        details.put("skipped", total - imported);
        auditLogService.record(actor, AuditActions.MARKET_PRICE_IMPORTED, MarketPriceService.ENTITY, batchId, null, details);
        log.info("CSV import {} by {}: {} rows, {} imported, {} skipped", batchId, actor.id(), total, imported, errorCount);
        return new CsvImportResult(total, imported, total - imported, List.copyOf(errors), batchId);
    }

    private static void addError(List<String> errors, long rowNumber, String message) {
        if (errors.size() < MAX_REPORTED_ERRORS) {
            errors.add("row " + rowNumber + ": " + message);
        }
    }

    /** Header plus one example row of each commodity type. */
    public String template() {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.builder().setHeader(TEMPLATE_HEADER).build())) {
            printer.printRecord("existing", "<commodity id>", "national", "", "", "", "Pasar Minggu", "traditional",
                    "Jl. Raya Pasar Minggu, Jakarta Selatan", "DKI Jakarta", "Jakarta Selatan", "15000", "standard",
                    "2025-01-20", "08:30:00", "Contoh menggunakan komoditas existing");
            printer.printRecord("new", "", "", "Tempe Lokal Segar", "kg", "lainnya", "Pasar Kebayoran", "traditional",
                    "Kebayoran Baru, Jakarta Selatan", "DKI Jakarta", "Jakarta Selatan", "12000", "standard",
                    "2025-01-20", "09:00:00", "Contoh membuat komoditas baru");
        } catch (IOException e) {
            throw new UncheckedIOException("Template generation failed", e);
        }
        return out.toString();
    }

    static MarketPriceSubmission toSubmission(CSVRecord record) {
        String type = column(record, "commodity_type");
        String priceText = column(record, "price");
        BigDecimal price = null;
        if (priceText != null) {
            try {
                price = new BigDecimal(priceText.replace(",", ""));
            } catch (NumberFormatException e) {
                throw new MarketPriceException(MarketPriceException.VALIDATION_FAILED, "invalid price '" + priceText + "'");
            }
        }
        String date = column(record, "date_recorded");
        String time = column(record, "time_recorded");
        return new MarketPriceSubmission(
                type != null ? type : "existing",
                column(record, "commodity_id"),
                column(record, "commodity_source"),
                column(record, "commodity_name"),
                firstNonNull(column(record, "commodity_unit"), column(record, "unit")),
                column(record, "commodity_category"),
                column(record, "market_name"),
                column(record, "market_type"),
                column(record, "market_location"),
                column(record, "province_name"),
                column(record, "city_name"),
                price,
                column(record, "quality_grade"),
                date != null ? LocalDate.parse(date) : null,
                time != null ? LocalTime.parse(time) : null,
                null,
                null,
                column(record, "notes"),
                null,
                null);
    }

    private static String column(CSVRecord record, String name) {
        if (!record.isMapped(name) || !record.isSet(name)) {
            return null;
        }
        String v = record.get(name);
        return v == null || v.isBlank() ? null : v.strip();
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }
}
