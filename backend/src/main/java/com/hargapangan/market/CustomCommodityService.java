package com.hargapangan.market;

import com.hargapangan.audit.Actor;
import com.hargapangan.audit.AuditActions;
import com.hargapangan.audit.AuditLogService;
import com.hargapangan.domain.CustomCommodity;
import com.hargapangan.domain.CustomCommodityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * User-defined commodities for market reports. Names are unique among active entries (case-insensitive).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomCommodityService {

    private static final String ENTITY = "custom_commodity";

    private final CustomCommodityRepository repository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public List<CustomCommodity> list(String category, String search, boolean includeInactive) {
        String needle = search != null && !search.isBlank() ? search.strip().toLowerCase(Locale.ROOT) : null;
        return repository.findAll(Sort.by("name")).stream()
                .filter(c -> includeInactive || c.isActive())
                .filter(c -> category == null || category.isBlank() || category.equalsIgnoreCase(c.getCategory()))
                .filter(c -> needle == null || (c.getName() != null && c.getName().toLowerCase(Locale.ROOT).contains(needle)))
                .toList();
    }

    public CustomCommodity get(String id) {
        return repository.findById(id)
                .orElseThrow(() -> new MarketPriceException(MarketPriceException.CUSTOM_COMMODITY_NOT_FOUND,
                        "Custom commodity not found: " + id));
    }

    /**
     * @throws MarketPriceException VALIDATION_FAILED when name, unit or category is blank;
     *                              CUSTOM_COMMODITY_EXISTS when an active one has the same name
     */
    public CustomCommodity create(String name, String unit, String category, String description, Actor actor) {
        requireFields(name, unit, category);
        if (nameTaken(name, null)) {
            throw new MarketPriceException(MarketPriceException.CUSTOM_COMMODITY_EXISTS, "Commodity with that name already exists");
        }
        CustomCommodity saved = repository.save(newCommodity(name, unit, category, description, actor));
        auditLogService.record(actor, AuditActions.CUSTOM_COMMODITY_CREATED, ENTITY, saved.getId(), null, snapshot(saved));
        log.info("Custom commodity {} '{}' created by {}", saved.getId(), saved.getName(), actor.id());
        return saved;
    }

    /**
     * Existing entry with exactly this (name, unit, category), or a new one.
     */
    public CustomCommodity findOrCreate(String name, String unit, String category, Actor actor) {
        requireFields(name, unit, category);
        return repository.findFirstByNameAndUnitAndCategory(name.strip(), unit.strip(), category.strip())
                .orElseGet(() -> {
                    CustomCommodity saved = repository.save(newCommodity(name, unit, category, null, actor));
                    auditLogService.record(actor, AuditActions.CUSTOM_COMMODITY_CREATED, ENTITY, saved.getId(), null, snapshot(saved));
                    return saved;
                });
    }

    public CustomCommodity update(String id, String name, String unit, String category, String description, Actor actor) {
        CustomCommodity c = get(id);
        requireFields(name, unit, category);
        if (nameTaken(name, id)) {
            throw new MarketPriceException(MarketPriceException.CUSTOM_COMMODITY_EXISTS, "Commodity with that name already exists");
        }
        Map<String, Object> before = snapshot(c);
        c.setName(name.strip());
        c.setUnit(unit.strip());
        c.setCategory(category.strip());
        if (description != null) {
            c.setDescription(description);
        }
        c.setUpdatedAt(Instant.now(clock));
        CustomCommodity saved = repository.save(c);
        auditLogService.record(actor, AuditActions.CUSTOM_COMMODITY_UPDATED, ENTITY, id, before, snapshot(saved));
        return saved;
    }

    public CustomCommodity deactivate(String id, Actor actor) {
        CustomCommodity c = get(id);
        Map<String, Object> before = snapshot(c);
        c.setActive(false);
        c.setUpdatedAt(Instant.now(clock));
        CustomCommodity saved = repository.save(c);
        auditLogService.record(actor, AuditActions.CUSTOM_COMMODITY_DEACTIVATED, ENTITY, id, before, snapshot(saved));
        return saved;
    }

    private CustomCommodity newCommodity(String name, String unit, String category, String description, Actor actor) {
        Instant now = Instant.now(clock);
        CustomCommodity c = new CustomCommodity();
        c.setName(name.strip());
        c.setUnit(unit.strip());
        c.setCategory(category.strip());
        c.setDescription(description);
        c.setCreatedBy(actor != null ? actor.id() : null);
        c.setActive(true);
        c.setCreatedAt(now);
        c.setUpdatedAt(now);
        return c;
    }

    private boolean nameTaken(String name, String exceptId) {
        String wanted = name.strip();
        return repository.findByActiveTrueOrderByNameAsc().stream()
                .anyMatch(c -> c.getName() != null && c.getName().equalsIgnoreCase(wanted) && !c.getId().equals(exceptId));
    }

    private static void requireFields(String name, String unit, String category) {
        if (isBlank(name) || isBlank(unit) || isBlank(category)) {
            throw new MarketPriceException(MarketPriceException.VALIDATION_FAILED, "Name, unit and category are required");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static Map<String, Object> snapshot(CustomCommodity c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", c.getName());
        m.put("unit", c.getUnit());
        m.put("category", c.getCategory());
        m.put("active", c.isActive());
        return m;
    }
}
