package com.hargapangan.ingestion.adapter;

import com.hargapangan.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientPriceInformationClientTest {

    private static final String PRICES = """
            {"status":"success","data":[
              {"id":109,"name":"Beras SPHP","satuan":"Rp/kg","today":12500,"yesterday":"12400","background":"https://cdn/beras.png"},
              {"id":"27","name":"Cabai Rawit Merah","satuan":"Rp/kg","today":null,"yesterday":58000},
              {"name":"Tanpa Id","today":1000}
            ]}
            """;

    private static RetryPolicy noWait(int attempts) {
        return new RetryPolicy(0L, 0.0, attempts);
    }

    private static RateLimiter throttle(int permits, Duration period, Duration timeout) {
        return RateLimiter.of("test-upstream", RateLimiterConfig.custom()
                .limitForPeriod(permits)
                .limitRefreshPeriod(period)
                .timeoutDuration(timeout)
                .build());
    }

    private static WebClientPriceInformationClient client(WebClient.Builder builder, int attempts) {
        return client(builder, attempts, throttle(1000, Duration.ofSeconds(1), Duration.ofSeconds(1)));
    }

    private static WebClientPriceInformationClient client(WebClient.Builder builder, int attempts, RateLimiter throttle) {
        return new WebClientPriceInformationClient(builder, "https://upstream.test/api/", Duration.ofSeconds(5),
                noWait(attempts), noWait(2), throttle);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    @Test
    @DisplayName("price envelope is parsed with numeric or textual ids and prices")
    void parsesPriceSnapshots() {
        List<PriceSnapshot> rows = WebClientPriceInformationClient.parsePriceSnapshots(PRICES);

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).isEqualTo(new PriceSnapshot(109, "Beras SPHP", "Rp/kg", "https://cdn/beras.png",
                new BigDecimal("12500"), new BigDecimal("12400")));
        assertThat(rows.get(1).externalId()).isEqualTo(27);
        assertThat(rows.get(1).priceToday()).isNull();
        assertThat(rows.get(2).externalId()).isNull();
    }

    @Test
    void nonSuccessEnvelopeIsMalformed() {
        assertThatThrownBy(() -> WebClientPriceInformationClient.parsePriceSnapshots("{\"status\":\"error\",\"message\":\"maintenance\"}"))
                .isInstanceOf(MalformedEnvelopeException.class)
                .hasMessageContaining("maintenance");
        assertThatThrownBy(() -> WebClientPriceInformationClient.parsePriceSnapshots("{\"status\":\"success\"}"))
                .isInstanceOf(MalformedEnvelopeException.class);
        assertThatThrownBy(() -> WebClientPriceInformationClient.parsePriceSnapshots("<html>"))
                .isInstanceOf(MalformedEnvelopeException.class);
    }

    @Test
    void regionsAcceptNamaOrName() {
        List<RegionSnapshot> regions = WebClientPriceInformationClient.parseRegions(
                "{\"status\":\"success\",\"data\":[{\"id\":31,\"nama\":\"DKI Jakarta\"},{\"id\":32,\"name\":\"Jawa Barat\"}]}");

        assertThat(regions).containsExactly(new RegionSnapshot(31, "DKI Jakarta"), new RegionSnapshot(32, "Jawa Barat"));
    }

    @Test
    @DisplayName("request carries province, city and level query parameters")
    void buildsPriceUrl() {
        List<ClientRequest> seen = new ArrayList<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            seen.add(req);
            return Mono.just(json(HttpStatus.OK, PRICES));
        });

        List<PriceSnapshot> rows = client(builder, 3).fetchPriceInformation(new PriceQuery("31", "", 3));

        assertThat(rows).hasSize(3);
        assertThat(seen).hasSize(1);
        String url = seen.get(0).url().toString();
        assertThat(url).startsWith("https://upstream.test/api/front/harga-pangan-informasi");
        assertThat(url).contains("province_id=31").contains("level_harga_id=3");
    }

    @Test
    @DisplayName("transient failures and malformed envelopes are retried until success")
    void retriesThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            int n = calls.incrementAndGet();
            if (n == 1) {
                return Mono.just(json(HttpStatus.BAD_GATEWAY, "{}"));
            }
            if (n == 2) {
                return Mono.just(json(HttpStatus.OK, "{\"status\":\"error\"}"));
            }
            return Mono.just(json(HttpStatus.OK, PRICES));
        });

        List<PriceSnapshot> rows = client(builder, 3).fetchPriceInformation(PriceQuery.national(3));

        assertThat(rows).hasSize(3);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("exhausted retries surface UpstreamUnavailableException with the attempt count")
    void exhaustedRetries() {
        AtomicInteger calls = new AtomicInteger();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            calls.incrementAndGet();
            return Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));
        });

        assertThatThrownBy(() -> client(builder, 3).fetchPriceInformation(PriceQuery.national(3)))
                .isInstanceOf(UpstreamUnavailableException.class)
                .satisfies(e -> assertThat(((UpstreamUnavailableException) e).getAttempts()).isEqualTo(3));
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("every upstream request takes a throttle permit; a refused permit is a failed attempt")
    void throttleGuardsEveryRequest() {
        AtomicInteger calls = new AtomicInteger();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            calls.incrementAndGet();
            return Mono.just(json(HttpStatus.OK, PRICES));
        });
        RateLimiter throttle = throttle(1, Duration.ofHours(1), Duration.ZERO);
        WebClientPriceInformationClient client = client(builder, 2, throttle);

        assertThat(client.fetchPriceInformation(PriceQuery.national(3))).hasSize(3);
        assertThatThrownBy(() -> client.fetchProvinces())
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("throttle");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("a throttle wait shorter than its timeout delays the request instead of failing it")
    void throttleWaitsForNextPermit() {
        AtomicInteger calls = new AtomicInteger();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            calls.incrementAndGet();
            return Mono.just(json(HttpStatus.OK, "{\"status\":\"success\",\"data\":[{\"id\":31,\"nama\":\"DKI Jakarta\"}]}"));
        });
        WebClientPriceInformationClient client = client(builder, 1,
                throttle(1, Duration.ofMillis(200), Duration.ofSeconds(2)));

        assertThat(client.fetchProvinces()).hasSize(1);
        assertThat(client.fetchProvinces()).hasSize(1);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("calls from a non-blocking reactor thread fail at once without touching the upstream")
    void refusesNonBlockingThreads() {
        AtomicInteger calls = new AtomicInteger();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            calls.incrementAndGet();
            return Mono.just(json(HttpStatus.OK, PRICES));
        });
        WebClientPriceInformationClient client = client(builder, 3);

        assertThatThrownBy(() -> Mono.fromCallable(() -> client.fetchPriceInformation(PriceQuery.national(3)))
                .subscribeOn(Schedulers.parallel())
                .block(Duration.ofSeconds(5)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("non-blocking");
        assertThat(calls.get()).isZero();

        List<PriceSnapshot> rows = Mono.fromCallable(() -> client.fetchPriceInformation(PriceQuery.national(3)))
                .subscribeOn(Schedulers.boundedElastic())
                .block(Duration.ofSeconds(5));
        assertThat(rows).hasSize(3);
    }
}
