package com.hargapangan.ingestion.registry;

import com.hargapangan.domain.Commodity;
import com.hargapangan.domain.CommodityRepository;
import com.hargapangan.ingestion.adapter.PriceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Find-or-create of national commodities keyed by upstream id. Name, unit and icon follow the
 * upstream; the category is set once on creation and never changed by sync.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommodityRegistry {

    private final CommodityRepository repository;
    private final Clock clock;

    /**
     * @return the registered commodity, or empty when the snapshot carries no upstream id
     */
    public Optional<Commodity> resolve(PriceSnapshot snapshot) {
        if (snapshot == null || snapshot.externalId() == null) {
            return Optional.empty();
        }
        Integer externalId = snapshot.externalId();
        Optional<Commodity> existing = repository.findByExternalId(externalId);
        if (existing.isPresent()) {
            return Optional.of(refresh(existing.get(), snapshot));
        }
        try {
            return Optional.of(repository.save(newCommodity(snapshot)));
        } catch (DuplicateKeyException e) {
            log.debug("Commodity externalId={} created concurrently; reloading", externalId);
            return repository.findByExternalId(externalId).map(c -> refresh(c, snapshot));
        }
    }

    private Commodity newCommodity(PriceSnapshot snapshot) {
        String name = hasText(snapshot.name()) ? snapshot.name() : "Komoditas " + snapshot.externalId();
        Instant now = Instant.now(clock);
        Commodity c = new Commodity();
        c.setExternalId(snapshot.externalId());
        c.setName(name);
        c.setUnit(hasText(snapshot.unit()) ? snapshot.unit() : Commodity.DEFAULT_UNIT);
        c.setIconUrl(snapshot.iconUrl());
        c.setCategory(CommodityCategoryClassifier.classify(name));
        c.setActive(true);
        c.setCreatedAt(now);
        c.setUpdatedAt(now);
        log.info("Registered commodity externalId={} name='{}' category={}", c.getExternalId(), name, c.getCategory());
        return c;
    }

    private Commodity refresh(Commodity commodity, PriceSnapshot snapshot) {
        boolean changed = false;
        if (hasText(snapshot.name()) && !Objects.equals(snapshot.name(), commodity.getName())) {
            commodity.setName(snapshot.name());
            changed = true;
        }
        if (hasText(snapshot.unit()) && !Objects.equals(snapshot.unit(), commodity.getUnit())) {
            commodity.setUnit(snapshot.unit());
            changed = true;
        }
        if (hasText(snapshot.iconUrl()) && !Objects.equals(snapshot.iconUrl(), commodity.getIconUrl())) {
            commodity.setIconUrl(snapshot.iconUrl());
            changed = true;
        }
        if (!changed) {
            return commodity;
        }
        commodity.setUpdatedAt(Instant.now(clock));
        log.info("Updated commodity externalId={} from upstream", commodity.getExternalId());
        return repository.save(commodity);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
