package com.hargapangan.ingestion.registry;

import com.hargapangan.audit.Actor;
import com.hargapangan.audit.AuditActions;
import com.hargapangan.audit.AuditLogService;
import com.hargapangan.domain.Commodity;
import com.hargapangan.domain.CommodityCategory;
import com.hargapangan.domain.CommodityRepository;
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
 * Admin maintenance of the national commodity registry. Deactivation is a soft delete; every
 * mutation is audited.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommodityAdminService {

    public static final String COMMODITY_NOT_FOUND = "COMMODITY_NOT_FOUND";
    public static final String INVALID_COMMODITY = "INVALID_COMMODITY";
    public static final String COMMODITY_EXISTS = "COMMODITY_EXISTS";

    private static final String ENTITY = "commodity";

    private final CommodityRepository repository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /** All filters optional; sorted by name. */
    public List<Commodity> list(CommodityCategory category, Boolean active, String search) {
        String needle = search != null && !search.isBlank() ? search.strip().toLowerCase(Locale.ROOT) : null;
        return repository.findAll(Sort.by("name")).stream()
                .filter(c -> category == null || category == c.getCategory())
                .filter(c -> active == null || active == c.isActive())
                .filter(c -> needle == null || (c.getName() != null && c.getName().toLowerCase(Locale.ROOT).contains(needle)))
                .toList();
    }

    public Commodity get(String id) {
        return repository.findById(id)
                .orElseThrow(() -> new CommodityServiceException(COMMODITY_NOT_FOUND, "Commodity not found: " + id));
    }

    /**
     * @throws CommodityServiceException INVALID_COMMODITY when name is blank; COMMODITY_EXISTS when externalId is taken
     */
    public Commodity create(CommodityCommand command, Actor actor) {
        if (command.name() == null || command.name().isBlank()) {
            throw new CommodityServiceException(INVALID_COMMODITY, "Name is required");
        }
        if (command.externalId() != null && repository.findByExternalId(command.externalId()).isPresent()) {
            throw new CommodityServiceException(COMMODITY_EXISTS, "Commodity with externalId " + command.externalId() + " exists");
        }
        Instant now = Instant.now(clock);
        Commodity c = new Commodity();
        c.setExternalId(command.externalId());
        c.setName(command.name().strip());
        c.setUnit(command.unit() != null && !command.unit().isBlank() ? command.unit().strip() : Commodity.DEFAULT_UNIT);
        c.setCategory(command.category() != null ? command.category() : CommodityCategoryClassifier.classify(c.getName()));
        c.setIconUrl(command.iconUrl());
        c.setActive(true);
        c.setCreatedAt(now);
        c.setUpdatedAt(now);
        Commodity saved = repository.save(c);
        auditLogService.record(actor, AuditActions.COMMODITY_CREATED, ENTITY, saved.getId(), null, snapshot(saved));
        log.info("Commodity {} created by {}", saved.getId(), actor.id());
        return saved;
    }

    /** Updates the non-null fields of the command. */
    public Commodity update(String id, CommodityCommand command, Actor actor) {
        Commodity c = get(id);
        Map<String, Object> before = snapshot(c);
        if (command.name() != null) {
            if (command.name().isBlank()) {
                throw new CommodityServiceException(INVALID_COMMODITY, "Name must not be blank");
            }
            c.setName(command.name().strip());
        }
        if (command.unit() != null && !command.unit().isBlank()) {
            c.setUnit(command.unit().strip());
        }
        if (command.category() != null) {
            c.setCategory(command.category());
        }
        if (command.iconUrl() != null) {
            c.setIconUrl(command.iconUrl());
        }
        c.setUpdatedAt(Instant.now(clock));
        Commodity saved = repository.save(c);
        auditLogService.record(actor, AuditActions.COMMODITY_UPDATED, ENTITY, id, before, snapshot(saved));
        return saved;
    }

    public Commodity deactivate(String id, Actor actor) {
        Commodity c = get(id);
        Map<String, Object> before = snapshot(c);
        c.setActive(false);
        c.setUpdatedAt(Instant.now(clock));
        Commodity saved = repository.save(c);
        auditLogService.record(actor, AuditActions.COMMODITY_DEACTIVATED, ENTITY, id, before, snapshot(saved));
        log.info("Commodity {} deactivated by {}", id, actor.id());
        return saved;
    }

    private static Map<String, Object> snapshot(Commodity c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", c.getName());
        m.put("unit", c.getUnit());
        m.put("category", c.getCategory() != null ? c.getCategory().getCode() : null);
        m.put("iconUrl", c.getIconUrl());
        m.put("active", c.isActive());
        return m;
    }

    /** Create/update input; null fields are left unchanged on update. */
    public record CommodityCommand(Integer externalId, String name, String unit, CommodityCategory category, String iconUrl) {
    }
}
