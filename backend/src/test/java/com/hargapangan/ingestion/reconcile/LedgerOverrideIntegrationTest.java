package com.hargapangan.ingestion.reconcile;

import com.hargapangan.audit.Actor;
import com.hargapangan.domain.CommodityRepository;
import com.hargapangan.domain.PriceLevel;
import com.hargapangan.domain.PriceOverride;
import com.hargapangan.domain.PriceOverrideRepository;
import com.hargapangan.domain.PricePoint;
import com.hargapangan.domain.PricePointRepository;
import com.hargapangan.domain.PriceSource;
import com.hargapangan.ingestion.adapter.PriceSnapshot;
import com.hargapangan.override.OverrideRequest;
import com.hargapangan.override.OverrideService;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Sync writes and manual overrides meeting on the same ledger row in MongoDB.
 */
@SpringBootTest(properties = {
        "hargapangan.sync.enabled=false",
        "hargapangan.ratelimit.enabled=false"
})
@Testcontainers(disabledWithoutDocker = true)
class LedgerOverrideIntegrationTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);
    private static final Actor ADMIN = new Actor("admin-1", Actor.Role.ADMIN, "127.0.0.1", "junit");
    private static final Actor EDITOR = new Actor("editor-1", Actor.Role.EDITOR, "127.0.0.1", "junit");

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    PriceLedgerReconciler reconciler;
    @Autowired
    OverrideService overrideService;
    @Autowired
    CommodityRepository commodityRepository;
    @Autowired
    PricePointRepository pricePointRepository;
    @Autowired
    PriceOverrideRepository overrideRepository;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void cleanDatabase() {
        mongoTemplate.getCollectionNames().stream()
                .filter(name -> !name.startsWith("system."))
                .forEach(name -> mongoTemplate.getCollection(name).deleteMany(new Document()));
    }

    private ReconcileResult sync(long price) {
        PriceSnapshot row = new PriceSnapshot(27, "Cabai Rawit Merah", "Rp/kg", null,
                BigDecimal.valueOf(price), BigDecimal.valueOf(price));
        return reconciler.reconcile(DAY, PriceLevel.KONSUMEN, List.of(row));
    }

    private String commodityId() {
        return commodityRepository.findByExternalId(27).orElseThrow().getId();
    }

    private PricePoint onlyRow() {
        List<PricePoint> rows = pricePointRepository.findAll();
        assertThat(rows).hasSize(1);
        return rows.get(0);
    }

    @Test
    @DisplayName("a sync after an applied override leaves the overridden price and flag untouched")
    void syncSkipsOverriddenRow() {
        assertThat(sync(12500).savedCount()).isEqualTo(1);

        PriceOverride applied = overrideService.create(new OverrideRequest(commodityId(), DAY, null,
                BigDecimal.valueOf(13000), "Harga pasar induk", "Survei lapangan", null), ADMIN);
        assertThat(applied.getStatus()).isEqualTo(PriceOverride.Status.APPROVED);

        ReconcileResult second = sync(12000);

        assertThat(second.skippedCount()).isEqualTo(1);
        assertThat(second.savedCount()).isZero();
        PricePoint row = onlyRow();
        assertThat(row.getPrice()).isEqualByComparingTo("13000");
        assertThat(row.isOverride()).isTrue();
        assertThat(row.getSource()).isEqualTo(PriceSource.MANUAL);
    }

    @Test
    @DisplayName("approving and then deleting an override restores the synced price")
    void approveThenDeleteRestoresSyncedPrice() {
        sync(12500);

        PriceOverride pending = overrideService.create(new OverrideRequest(commodityId(), DAY, null,
                BigDecimal.valueOf(20000), "Kelangkaan pasokan", null, null), EDITOR);
        assertThat(pending.getStatus()).isEqualTo(PriceOverride.Status.PENDING);
        assertThat(onlyRow().getPrice()).isEqualByComparingTo("12500");

        overrideService.decide(pending.getId(), "approved", null, ADMIN);
        PricePoint overridden = onlyRow();
        assertThat(overridden.getPrice()).isEqualByComparingTo("20000");
        assertThat(overridden.getSource()).isEqualTo(PriceSource.MANUAL);
        assertThat(overridden.isOverride()).isTrue();

        overrideService.delete(pending.getId(), ADMIN);

        PricePoint restored = onlyRow();
        assertThat(restored.getId()).isEqualTo(overridden.getId());
        assertThat(restored.getPrice()).isEqualByComparingTo("12500");
        assertThat(restored.getSource()).isEqualTo(PriceSource.API);
        assertThat(restored.isOverride()).isFalse();
        assertThat(overrideRepository.findById(pending.getId())).isEmpty();

        assertThat(sync(12600).savedCount()).isEqualTo(1);
        assertThat(onlyRow().getPrice()).isEqualByComparingTo("12600");
    }
}
