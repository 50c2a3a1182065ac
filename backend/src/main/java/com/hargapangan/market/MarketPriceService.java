package com.hargapangan.market;

import com.hargapangan.audit.Actor;
import com.hargapangan.audit.AuditActions;
import com.hargapangan.audit.AuditLogService;
import com.hargapangan.domain.CommodityRef;
import com.hargapangan.domain.CustomCommodity;
import com.hargapangan.domain.CustomCommodityRef;
import com.hargapangan.domain.MarketPriceFilter;
import com.hargapangan.domain.MarketPriceReport;
import com.hargapangan.domain.MarketPriceReportRepository;
import com.hargapangan.domain.MarketPriceReportRepositoryCustom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Market price reports: submission (with find-or-create of custom commodities), edits by the reporter
 * or an admin, admin verification, deletion with evidence cleanup, search and statistics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketPriceService {

    static final String ENTITY = "market_price";
    private static final int MAX_PAGE_SIZE = 200;

    private final MarketPriceReportRepository repository;
    private final CommodityRefResolver commodityRefResolver;
    private final CustomCommodityService customCommodityService;
    private final EvidenceFileStore evidenceFileStore;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /**
     * @throws MarketPriceException VALIDATION_FAILED, COMMODITY_NOT_FOUND
     */
    public MarketPriceReport submit(MarketPriceSubmission request, Actor actor) {
        MarketPriceReport report = buildReport(request, actor, MarketPriceReport.EntrySource.MANUAL, null);
        MarketPriceReport saved = repository.save(report);
        auditLogService.record(actor, AuditActions.MARKET_PRICE_CREATED, ENTITY, saved.getId(), null, snapshot(saved));
        log.info("Market price {} submitted by {} for {} {}", saved.getId(), actor.id(), saved.getCommoditySource(), saved.getCommodityId());
        return saved;
    }

    /**
     * Validates and resolves a submission into an unsaved report. Shared with the CSV importer.
     */
    MarketPriceReport buildReport(MarketPriceSubmission request, Actor actor, MarketPriceReport.EntrySource entrySource,
                                  String importBatchId) {
        if (isBlank(request.marketName()) || request.price() == null || request.dateRecorded() == null) {
            throw validation("Missing required fields: market_name, price, date_recorded");
        }
        if (request.price().signum() <= 0) {
            throw validation("Price must be positive");
        }
        ResolvedCommodity commodity = resolveCommodity(request, actor);
        Instant now = Instant.now(clock);

        MarketPriceReport r = new MarketPriceReport();
        r.setCommodity(commodity.ref());
        r.setUnit(commodity.unit());
        r.setMarketName(request.marketName().strip());
        r.setMarketType(parseMarketType(request.marketType()));
        r.setMarketLocation(request.marketLocation());
        r.setProvinceName(request.provinceName());
        r.setCityName(request.cityName());
        r.setPrice(request.price());
        r.setQualityGrade(parseQualityGrade(request.qualityGrade()));
        r.setDateRecorded(request.dateRecorded());
        r.setTimeRecorded(request.timeRecorded());
        r.setPrimaryImage(request.primaryImage());
        r.setAdditionalImages(request.additionalImages() != null ? new ArrayList<>(request.additionalImages()) : new ArrayList<>());
        r.setNotes(request.notes());
        r.setLatitude(request.latitude());
        r.setLongitude(request.longitude());
        r.setEntrySource(entrySource);
        r.setImportBatchId(importBatchId);
        r.setVerificationStatus(MarketPriceReport.VerificationStatus.PENDING);
        r.setReportedBy(actor.id());
        r.setActive(true);
        r.setCreatedAt(now);
        r.setUpdatedAt(now);
        return r;
    }

    private ResolvedCommodity resolveCommodity(MarketPriceSubmission request, Actor actor) {
        if ("new".equalsIgnoreCase(request.commodityType())) {
            if (isBlank(request.commodityName()) || isBlank(request.commodityUnit()) || isBlank(request.commodityCategory())) {
                throw validation("For new commodity: commodity_name, commodity_unit and commodity_category are required");
            }
            CustomCommodity custom = customCommodityService.findOrCreate(
                    request.commodityName(), request.commodityUnit(), request.commodityCategory(), actor);
            return new ResolvedCommodity(new CustomCommodityRef(custom.getId()), custom.getName(), custom.getUnit(), custom.getCategory());
        }
        if (isBlank(request.commodityId())) {
            throw validation("commodity_id is required for existing commodity");
        }
        String id = request.commodityId().strip();
        return (isBlank(request.commoditySource())
                ? commodityRefResolver.resolveAny(id)
                : commodityRefResolver.resolve(CommodityRef.of(request.commoditySource(), id)))
                .orElseThrow(() -> new MarketPriceException(MarketPriceException.COMMODITY_NOT_FOUND, "Commodity not found: " + id));
    }

    public MarketPriceReport get(String id) {
        return repository.findById(id)
                .filter(MarketPriceReport::isActive)
                .orElseThrow(() -> new MarketPriceException(MarketPriceException.REPORT_NOT_FOUND, "Market price not found: " + id));
    }

    /**
     * @throws MarketPriceException REPORT_NOT_FOUND, FORBIDDEN (not the reporter and not admin), VALIDATION_FAILED
     */
    public MarketPriceReport update(String id, MarketPriceUpdate update, Actor actor) {
        MarketPriceReport r = get(id);
        if (!actor.isElevated() && (actor.id() == null || !actor.id().equals(r.getReportedBy()))) {
            throw new MarketPriceException(MarketPriceException.FORBIDDEN, "Only the reporter or an admin may edit this report");
        }
        Map<String, Object> before = snapshot(r);
        if (update.marketName() != null) {
            if (update.marketName().isBlank()) {
                throw validation("market_name must not be blank");
            }
            r.setMarketName(update.marketName().strip());
        }
        if (update.marketType() != null) {
            r.setMarketType(parseMarketType(update.marketType()));
        }
        if (update.marketLocation() != null) {
            r.setMarketLocation(update.marketLocation());
        }
        if (update.provinceName() != null) {
            r.setProvinceName(update.provinceName());
        }
        if (update.cityName() != null) {
            r.setCityName(update.cityName());
        }
        if (update.price() != null) {
            if (update.price().signum() <= 0) {
                throw validation("Price must be positive");
            }
            r.setPrice(update.price());
        }
        if (update.qualityGrade() != null) {
            r.setQualityGrade(parseQualityGrade(update.qualityGrade()));
        }
        if (update.dateRecorded() != null) {
            r.setDateRecorded(update.dateRecorded());
        }
        if (update.timeRecorded() != null) {
            r.setTimeRecorded(update.timeRecorded());
        }
        if (update.notes() != null) {
            r.setNotes(update.notes());
        }
        if (update.latitude() != null) {
            r.setLatitude(update.latitude());
        }
        if (update.longitude() != null) {
            r.setLongitude(update.longitude());
        }
        List<String> removed = new ArrayList<>();
        if (update.primaryImage() != null && !update.primaryImage().equals(r.getPrimaryImage())) {
            if (r.getPrimaryImage() != null) {
                removed.add(r.getPrimaryImage());
            }
            r.setPrimaryImage(update.primaryImage().isBlank() ? null : update.primaryImage());
        }
        List<String> images = new ArrayList<>(r.getAdditionalImages() != null ? r.getAdditionalImages() : List.of());
        if (update.removeImages() != null) {
            for (String ref : update.removeImages()) {
                if (images.remove(ref)) {
                    removed.add(ref);
                }
            }
        }
        if (update.addImages() != null) {
            update.addImages().stream().filter(s -> !isBlank(s)).forEach(images::add);
        }
        r.setAdditionalImages(images);
        r.setUpdatedAt(Instant.now(clock));
        MarketPriceReport saved = repository.save(r);
        if (!removed.isEmpty()) {
            evidenceFileStore.deleteAll(removed);
        }
        auditLogService.record(actor, AuditActions.MARKET_PRICE_UPDATED, ENTITY, id, before, snapshot(saved));
        return saved;
    }

    /**
     * @param status verified, rejected or pending
     * @throws MarketPriceException FORBIDDEN unless admin; VALIDATION_FAILED for an unknown status
     */
    public MarketPriceReport verify(String id, String status, Actor actor) {
        if (!actor.isElevated()) {
            throw new MarketPriceException(MarketPriceException.FORBIDDEN, "Only admins may verify market prices");
        }
        MarketPriceReport.VerificationStatus target = parseEnum(MarketPriceReport.VerificationStatus.class, status, null);
        if (target == null) {
            throw validation("Verification status must be pending, verified or rejected");
        }
        MarketPriceReport r = get(id);
        Map<String, Object> before = Map.of("verificationStatus", lower(r.getVerificationStatus()));
        r.setVerificationStatus(target);
        r.setVerifiedBy(actor.id());
        r.setVerifiedAt(Instant.now(clock));
        r.setUpdatedAt(r.getVerifiedAt());
        MarketPriceReport saved = repository.save(r);
        auditLogService.record(actor, AuditActions.MARKET_PRICE_VERIFIED, ENTITY, id, before,
                Map.of("verificationStatus", lower(target)));
        log.info("Market price {} marked {} by {}", id, target, actor.id());
        return saved;
    }

    /**
     * Removes the report and its evidence files.
     *
     * @throws MarketPriceException REPORT_NOT_FOUND, FORBIDDEN
     */
    public void delete(String id, Actor actor) {
        MarketPriceReport r = get(id);
        if (!actor.isElevated() && (actor.id() == null || !actor.id().equals(r.getReportedBy()))) {
            throw new MarketPriceException(MarketPriceException.FORBIDDEN, "Only the reporter or an admin may delete this report");
        }
        List<String> files = new ArrayList<>();
        if (r.getPrimaryImage() != null) {
            files.add(r.getPrimaryImage());
        }
        if (r.getAdditionalImages() != null) {
            files.addAll(r.getAdditionalImages());
        }
        auditLogService.record(actor, AuditActions.MARKET_PRICE_DELETED, ENTITY, id, snapshot(r), null);
        repository.delete(r);
        if (!files.isEmpty()) {
            evidenceFileStore.deleteAll(files);
        }
        log.info("Market price {} deleted by {}", id, actor.id());
    }

    public Page<MarketPriceReport> search(MarketPriceFilter filter, int page, int size) {
        int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return repository.search(filter != null ? filter : MarketPriceFilter.none(), PageRequest.of(Math.max(0, page), safeSize));
    }

    public MarketPriceStats stats() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        long total = 0;
        for (MarketPriceReport.VerificationStatus s : MarketPriceReport.VerificationStatus.values()) {
            long n = repository.countByVerificationStatus(s);
            byStatus.put(lower(s), n);
            total += n;
        }
        Map<String, Long> byType = new LinkedHashMap<>();
        for (MarketPriceReport.MarketType t : MarketPriceReport.MarketType.values()) {
            byType.put(lower(t), repository.countByMarketType(t));
        }
        List<MarketPriceStats.CommodityAverage> averages = new ArrayList<>();
        for (MarketPriceReportRepositoryCustom.CommodityAverage a : repository.averagePriceByCommodity()) {
            String name = a.commodityId() == null ? null : commodityRefResolver.resolve(CommodityRef.of(a.commoditySource(), a.commodityId()))
                    .map(ResolvedCommodity::name)
                    .orElse(null);
            averages.add(new MarketPriceStats.CommodityAverage(a.commoditySource(), a.commodityId(), name, a.avgPrice(), a.reports()));
        }
        return new MarketPriceStats(total, byStatus, byType, averages);
    }

    static MarketPriceReport.MarketType parseMarketType(String value) {
        MarketPriceReport.MarketType t = parseEnum(MarketPriceReport.MarketType.class, value, MarketPriceReport.MarketType.TRADITIONAL);
        if (t == null) {
            throw validation("Unknown market_type: " + value);
        }
        return t;
    }

    static MarketPriceReport.QualityGrade parseQualityGrade(String value) {
        MarketPriceReport.QualityGrade g = parseEnum(MarketPriceReport.QualityGrade.class, value, MarketPriceReport.QualityGrade.STANDARD);
        if (g == null) {
            throw validation("Unknown quality_grade: " + value);
        }
        return g;
    }

    /** Blank means the default; an unknown value yields null. */
    static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E defaultValue) {
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static Map<String, Object> snapshot(MarketPriceReport r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("commoditySource", r.getCommoditySource());
        m.put("commodityId", r.getCommodityId());
        m.put("marketName", r.getMarketName());
        m.put("price", r.getPrice() != null ? r.getPrice().toPlainString() : null);
        m.put("dateRecorded", r.getDateRecorded() != null ? r.getDateRecorded().toString() : null);
        m.put("verificationStatus", lower(r.getVerificationStatus()));
        return m;
    }

    private static String lower(Enum<?> e) {
        return e == null ? null : e.name().toLowerCase(Locale.ROOT);
    }

    private static MarketPriceException validation(String message) {
        return new MarketPriceException(MarketPriceException.VALIDATION_FAILED, message);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
