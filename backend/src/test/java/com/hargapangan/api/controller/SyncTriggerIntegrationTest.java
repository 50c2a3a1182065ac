package com.hargapangan.api.controller;

import com.hargapangan.domain.PriceLevel;
import com.hargapangan.domain.PricePoint;
import com.hargapangan.domain.PricePointRepository;
import com.hargapangan.domain.Region;
import com.hargapangan.domain.RegionRepository;
import org.bson.Document;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Manual sync over a real Reactor Netty server against a stub price API, so the cycle runs exactly
 * as it does behind the event loop in production.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "hargapangan.sync.enabled=false",
        "hargapangan.ratelimit.enabled=false",
        "hargapangan.upstream.timeout-seconds=5",
        "hargapangan.upstream.retry.max-attempts=1",
        "hargapangan.upstream.region-retry.max-attempts=1"
})
@Testcontainers(disabledWithoutDocker = true)
class SyncTriggerIntegrationTest {

    private static final String PRICES = """
            {"status":"success","data":[
              {"id":109,"name":"Beras SPHP","satuan":"Rp/kg","today":12500,"yesterday":12400},
              {"id":27,"name":"Cabai Rawit Merah","satuan":"Rp/kg","today":58000,"yesterday":57000}
            ]}
            """;
    private static final String PROVINCES = """
            {"status":"success","data":[{"id":31,"nama":"DKI Jakarta"}]}
            """;

    private static final AtomicInteger upstreamCalls = new AtomicInteger();

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    static DisposableServer upstream = HttpServer.create()
            .port(0)
            .handle((request, response) -> {
                upstreamCalls.incrementAndGet();
                String body = request.uri().startsWith("/api/provinces") ? PROVINCES : PRICES;
                return response.header("Content-Type", MediaType.APPLICATION_JSON_VALUE).sendString(Mono.just(body));
            })
            .bindNow();

    @DynamicPropertySource
    static void properties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
        registry.add("hargapangan.upstream.base-url", () -> "http://localhost:" + upstream.port() + "/api");
    }

    @AfterAll
    static void stopUpstream() {
        upstream.disposeNow();
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    PricePointRepository pricePointRepository;
    @Autowired
    RegionRepository regionRepository;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void cleanDatabase() {
        upstreamCalls.set(0);
        mongoTemplate.getCollectionNames().stream()
                .filter(name -> !name.startsWith("system."))
                .forEach(name -> mongoTemplate.getCollection(name).deleteMany(new Document()));
    }

    @Test
    @DisplayName("manual trigger fetches, reconciles and answers 200 with the cycle result")
    void manualTriggerRunsCycle() {
        webTestClient.mutate().responseTimeout(Duration.ofSeconds(30)).build()
                .post().uri("/api/v1/sync/trigger")
                .header("X-User-Id", "admin-1")
                .header("X-User-Role", "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("syncRegions", true))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.received").isEqualTo(2)
                .jsonPath("$.regionsCreated").isEqualTo(1)
                .jsonPath("$.reconcile.savedCount").isEqualTo(2);

        List<PricePoint> rows = pricePointRepository.findAll();
        assertThat(rows).hasSize(2);
        assertThat(rows).allMatch(p -> p.getLevel() == PriceLevel.KONSUMEN && !p.isOverride());
        assertThat(regionRepository.findByLevelOrderByProvinceNameAsc(Region.Level.PROVINCE))
                .extracting(Region::getProvinceName)
                .containsExactly("DKI Jakarta");
        assertThat(upstreamCalls.get()).isEqualTo(2);

        webTestClient.get().uri("/api/v1/sync/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.running").isEqualTo(false)
                .jsonPath("$.lastResult.success").isEqualTo(true);
    }

    @Test
    void triggerRequiresAdmin() {
        webTestClient.post().uri("/api/v1/sync/trigger")
                .header("X-User-Id", "u-1")
                .header("X-User-Role", "editor")
                .exchange()
                .expectStatus().isForbidden();
        assertThat(upstreamCalls.get()).isZero();
    }
}
