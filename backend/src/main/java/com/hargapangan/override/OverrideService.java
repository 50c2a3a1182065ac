package com.hargapangan.override;

import com.hargapangan.audit.Actor;
import com.hargapangan.audit.AuditActions;
import com.hargapangan.audit.AuditLogService;
import com.hargapangan.common.Percentages;
import com.hargapangan.domain.CommodityRepository;
import com.hargapangan.domain.PriceLedgerChangedEvent;
import com.hargapangan.domain.PriceOverride;
import com.hargapangan.domain.PriceOverrideRepository;
import com.hargapangan.domain.PricePoint;
import com.hargapangan.domain.PricePointRepository;
import com.hargapangan.domain.PriceSource;
import com.hargapangan.override.config.OverrideProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Manual price corrections with an approval step. An APPROVED override has been applied to its
 * PricePoint (price=requested, source=manual, override=true); delete and expiry restore the original
 * price and source. Rule violations are audited before the exception is thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OverrideService {

    public static final String COMMODITY_NOT_FOUND = "COMMODITY_NOT_FOUND";
    public static final String NO_CURRENT_PRICE = "NO_CURRENT_PRICE";
    public static final String OVERRIDE_EXISTS = "OVERRIDE_EXISTS";
    public static final String OVERRIDE_NOT_FOUND = "OVERRIDE_NOT_FOUND";
    public static final String INVALID_DECISION = "INVALID_DECISION";
    public static final String INVALID_PRICE = "INVALID_PRICE";
    public static final String ALREADY_PROCESSED = "ALREADY_PROCESSED";
    public static final String SELF_APPROVAL = "SELF_APPROVAL";

    static final String ENTITY = "price_override";
    private static final Set<PriceOverride.Status> OPEN = EnumSet.of(PriceOverride.Status.PENDING, PriceOverride.Status.APPROVED);
    private static final int MAX_PAGE_SIZE = 100;

    private final CommodityRepository commodityRepository;
    private final PricePointRepository pricePointRepository;
    private final PriceOverrideRepository overrideRepository;
    private final AuditLogService auditLogService;
    private final OverrideProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * Creates an override against the current PricePoint of (commodity, date, region). Applied at once
     * when the change is within the approval threshold or the actor is elevated; PENDING otherwise.
     *
     * @throws OverrideServiceException COMMODITY_NOT_FOUND, NO_CURRENT_PRICE, OVERRIDE_EXISTS, INVALID_PRICE
     */
    public PriceOverride create(OverrideRequest request, Actor actor) {
        if (request.requestedPrice() == null || request.requestedPrice().signum() <= 0) {
            throw rejected(actor, INVALID_PRICE, "Requested price must be positive", request.commodityId());
        }
        if (request.commodityId() == null || !commodityRepository.existsById(request.commodityId())) {
            throw rejected(actor, COMMODITY_NOT_FOUND, "Commodity not found: " + request.commodityId(), request.commodityId());
        }
        PricePoint current = pricePointRepository
                .findFirstByCommodityIdAndDateAndRegionIdOrderByUpdatedAtDesc(request.commodityId(), request.date(), request.regionId())
                .orElseThrow(() -> rejected(actor, NO_CURRENT_PRICE,
                        "No current price for commodity " + request.commodityId() + " on " + request.date(), request.commodityId()));
        if (overrideRepository.existsByPricePointIdAndStatusIn(current.getId(), OPEN)) {
            throw rejected(actor, OVERRIDE_EXISTS, "An open override already targets price " + current.getId(), request.commodityId());
        }

        BigDecimal deltaPct = Percentages.precise(current.getPrice(), request.requestedPrice());
        boolean needsApproval = deltaPct.compareTo(properties.getApprovalThresholdPct()) > 0 && !actor.isElevated();
        Instant now = Instant.now(clock);

        PriceOverride override = new PriceOverride();
        override.setPricePointId(current.getId());
        override.setCommodityId(request.commodityId());
        override.setDate(request.date());
        override.setRegionId(request.regionId());
        override.setOriginalPrice(current.getPrice());
        override.setOriginalSource(current.getSource());
        override.setRequestedPrice(request.requestedPrice());
        override.setReason(request.reason());
        override.setSourceInfo(request.sourceInfo());
        override.setEvidenceRef(request.evidenceRef());
        override.setRequestedBy(actor.id());
        override.setCreatedAt(now);
        override.setExpiresAt(now.plus(Duration.ofHours(properties.getTtlHours())));
        if (needsApproval) {
            override.setStatus(PriceOverride.Status.PENDING);
        } else {
            override.setStatus(PriceOverride.Status.APPROVED);
            override.setApprovedBy(actor.id());
            override.setDecidedAt(now);
            applyToPricePoint(current, request.requestedPrice());
        }
        PriceOverride saved = overrideRepository.save(override);

        Map<String, Object> oldValues = new LinkedHashMap<>();
        oldValues.put("price", current.getPrice() == null ? null : current.getPrice().toPlainString());
        oldValues.put("source", current.getSource() != null ? current.getSource().getCode() : null);
        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("price", request.requestedPrice().toPlainString());
        newValues.put("status", saved.getStatus().name().toLowerCase());
        newValues.put("deltaPct", deltaPct.toPlainString());
        newValues.put("reason", request.reason());
        auditLogService.record(actor, AuditActions.PRICE_OVERRIDE, ENTITY, saved.getId(), oldValues, newValues);

        log.info("Override {} for commodity {} on {} by {}: {} -> {} ({}%), status {}",
                saved.getId(), request.commodityId(), request.date(), actor.id(),
                current.getPrice(), request.requestedPrice(), deltaPct, saved.getStatus());
        return saved;
    }

    /**
     * Approve or reject a PENDING override. Approval applies it to the PricePoint.
     *
     * @param decision "approved" or "rejected" (any case)
     * @throws OverrideServiceException OVERRIDE_NOT_FOUND, INVALID_DECISION, ALREADY_PROCESSED, SELF_APPROVAL
     */
    public PriceOverride decide(String overrideId, String decision, String rejectionReason, Actor approver) {
        PriceOverride override = overrideRepository.findById(overrideId)
                .orElseThrow(() -> rejected(approver, OVERRIDE_NOT_FOUND, "Override not found: " + overrideId, overrideId));
        PriceOverride.Status target = parseDecision(decision);
        if (target == null) {
            throw rejected(approver, INVALID_DECISION, "Decision must be approved or rejected", overrideId);
        }
        if (override.getStatus() != PriceOverride.Status.PENDING) {
            throw rejected(approver, ALREADY_PROCESSED, "Override already processed: " + override.getStatus(), overrideId);
        }
        if (approver.id() != null && approver.id().equals(override.getRequestedBy())) {
            throw rejected(approver, SELF_APPROVAL, "Requester cannot decide their own override", overrideId);
        }

        Instant now = Instant.now(clock);
        if (target == PriceOverride.Status.APPROVED) {
            PricePoint point = pricePointRepository.findById(override.getPricePointId())
                    .orElseThrow(() -> rejected(approver, NO_CURRENT_PRICE, "Target price no longer exists", overrideId));
            override.setOriginalPrice(point.getPrice());
            override.setOriginalSource(point.getSource());
            applyToPricePoint(point, override.getRequestedPrice());
        } else {
            override.setRejectionReason(rejectionReason);
        }
        override.setStatus(target);
        override.setApprovedBy(approver.id());
        override.setDecidedAt(now);
        PriceOverride saved = overrideRepository.save(override);

        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("status", target.name().toLowerCase());
        newValues.put("rejectionReason", rejectionReason);
        String action = target == PriceOverride.Status.APPROVED ? AuditActions.OVERRIDE_APPROVED : AuditActions.OVERRIDE_REJECTED;
        auditLogService.record(approver, action, ENTITY, overrideId, Map.of("status", "pending"), newValues);
        log.info("Override {} {} by {}", overrideId, target, approver.id());
        return saved;
    }

    /**
     * Removes an override. An APPROVED one is reverted first.
     *
     * @throws OverrideServiceException OVERRIDE_NOT_FOUND
     */
    public void delete(String overrideId, Actor actor) {
        PriceOverride override = overrideRepository.findById(overrideId)
                .orElseThrow(() -> rejected(actor, OVERRIDE_NOT_FOUND, "Override not found: " + overrideId, overrideId));
        if (override.getStatus() == PriceOverride.Status.APPROVED) {
            revertPricePoint(override);
        }
        auditLogService.record(actor, AuditActions.OVERRIDE_DELETED, ENTITY, overrideId, snapshot(override), null);
        overrideRepository.delete(override);
        log.info("Override {} deleted by {}", overrideId, actor.id());
    }

    /**
     * Marks every open override past its expiresAt as EXPIRED; approved ones are reverted first.
     *
     * @return number of overrides expired
     */
    public int expireDue() {
        Instant now = Instant.now(clock);
        List<PriceOverride> due = overrideRepository.findByStatusInAndExpiresAtBefore(OPEN, now);
        int expired = 0;
        for (PriceOverride override : due) {
            try {
                PriceOverride.Status previous = override.getStatus();
                if (previous == PriceOverride.Status.APPROVED) {
                    revertPricePoint(override);
                }
                override.setStatus(PriceOverride.Status.EXPIRED);
                override.setDecidedAt(override.getDecidedAt() != null ? override.getDecidedAt() : now);
                overrideRepository.save(override);
                auditLogService.record(Actor.system(), AuditActions.OVERRIDE_EXPIRED, ENTITY, override.getId(),
                        Map.of("status", previous.name().toLowerCase()), Map.of("status", "expired"));
                expired++;
            } catch (Exception e) {
                log.error("Failed to expire override {}", override.getId(), e);
            }
        }
        if (expired > 0) {
            log.info("Expired {} overrides", expired);
        }
        return expired;
    }

    public PriceOverride get(String overrideId) {
        return overrideRepository.findById(overrideId)
                .orElseThrow(() -> new OverrideServiceException(OVERRIDE_NOT_FOUND, "Override not found: " + overrideId));
    }

    /** Newest first; all filters optional. */
    public Page<PriceOverride> list(PriceOverride.Status status, String commodityId, LocalDate from, LocalDate to,
                                    int page, int size) {
        int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return overrideRepository.search(status, commodityId, from, to, PageRequest.of(Math.max(0, page), safeSize));
    }

    private void applyToPricePoint(PricePoint point, BigDecimal price) {
        point.setPrice(price);
        point.setSource(PriceSource.MANUAL);
        point.setOverride(true);
        point.setUpdatedAt(Instant.now(clock));
        pricePointRepository.save(point);
        applicationEventPublisher.publishEvent(new PriceLedgerChangedEvent(point.getDate(), "override_applied"));
    }

    private void revertPricePoint(PriceOverride override) {
        pricePointRepository.findById(override.getPricePointId()).ifPresentOrElse(point -> {
            point.setPrice(override.getOriginalPrice());
            point.setSource(override.getOriginalSource() != null ? override.getOriginalSource() : PriceSource.API);
            point.setOverride(false);
            point.setUpdatedAt(Instant.now(clock));
            pricePointRepository.save(point);
            applicationEventPublisher.publishEvent(new PriceLedgerChangedEvent(point.getDate(), "override_reverted"));
        }, () -> log.warn("Price point {} of override {} no longer exists; nothing to revert",
                override.getPricePointId(), override.getId()));
    }

    private OverrideServiceException rejected(Actor actor, String code, String message, String entityId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errorCode", code);
        details.put("message", message);
        try {
            auditLogService.record(actor, AuditActions.OVERRIDE_REJECTED_REQUEST, ENTITY, entityId, null, details);
        } catch (Exception e) {
            log.warn("Could not audit rejected override request {}: {}", code, e.getMessage());
        }
        return new OverrideServiceException(code, message);
    }

    private static PriceOverride.Status parseDecision(String decision) {
        if (decision == null) {
            return null;
        }
        return switch (decision.strip().toLowerCase()) {
            case "approved" -> PriceOverride.Status.APPROVED;
            case "rejected" -> PriceOverride.Status.REJECTED;
            default -> null;
        };
    }

    private static Map<String, Object> snapshot(PriceOverride o) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("pricePointId", o.getPricePointId());
        m.put("commodityId", o.getCommodityId());
        m.put("date", o.getDate() != null ? o.getDate().toString() : null);
        m.put("regionId", o.getRegionId());
        m.put("originalPrice", o.getOriginalPrice() != null ? o.getOriginalPrice().toPlainString() : null);
        m.put("originalSource", o.getOriginalSource() != null ? o.getOriginalSource().getCode() : null);
        m.put("requestedPrice", o.getRequestedPrice() != null ? o.getRequestedPrice().toPlainString() : null);
        m.put("status", o.getStatus() != null ? o.getStatus().name().toLowerCase() : null);
        m.put("requestedBy", o.getRequestedBy());
        m.put("approvedBy", o.getApprovedBy());
        return m;
    }
}
