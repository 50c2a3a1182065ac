package com.hargapangan.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hargapangan.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Price information client using WebClient. Calls block with a per-request timeout, so they must run on a
 * worker thread (the sync scheduler or a bounded-elastic worker), never on a Netty event loop. Every request
 * takes a permit from the shared upstream throttle first. Failures, throttle timeouts and malformed envelopes
 * are retried per {@link RetryPolicy}, then surfaced as {@link UpstreamUnavailableException}.
 */
@Slf4j
public class WebClientPriceInformationClient implements PriceInformationClient {

    static final String PRICE_PATH = "/front/harga-pangan-informasi";
    static final String PROVINCES_PATH = "/provinces";
    static final String CITIES_PATH = "/cities";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient webClient;
    private final String baseUrl;
    private final Duration timeout;
    private final RetryPolicy priceRetryPolicy;
    private final RetryPolicy regionRetryPolicy;
    private final RateLimiter rateLimiter;

    public WebClientPriceInformationClient(WebClient.Builder builder,
                                           String baseUrl,
                                           Duration timeout,
                                           RetryPolicy priceRetryPolicy,
                                           RetryPolicy regionRetryPolicy,
                                           RateLimiter rateLimiter) {
        this.webClient = builder
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "id-ID,id;q=0.9,en;q=0.8")
                .defaultHeader(HttpHeaders.CACHE_CONTROL, "no-cache")
                .build();
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.timeout = timeout;
        this.priceRetryPolicy = priceRetryPolicy;
        this.regionRetryPolicy = regionRetryPolicy;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public List<PriceSnapshot> fetchPriceInformation(PriceQuery query) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl + PRICE_PATH)
                .queryParam("province_id", query.provinceId())
                .queryParam("city_id", query.cityId())
                .queryParam("level_harga_id", query.levelHargaId())
                .toUriString();
        List<PriceSnapshot> snapshots = callWithRetry(url, priceRetryPolicy, WebClientPriceInformationClient::parsePriceSnapshots);
        log.info("Received {} price rows from upstream (province='{}', city='{}', level={})",
                snapshots.size(), query.provinceId(), query.cityId(), query.levelHargaId());
        return snapshots;
    }

    @Override
    public List<RegionSnapshot> fetchProvinces() {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl + PROVINCES_PATH)
                .queryParam("search", "")
                .toUriString();
        return callWithRetry(url, regionRetryPolicy, WebClientPriceInformationClient::parseRegions);
    }

    @Override
    public List<RegionSnapshot> fetchCities(int provinceId) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl + CITIES_PATH)
                .queryParam("province_id", provinceId)
                .toUriString();
        return callWithRetry(url, regionRetryPolicy, WebClientPriceInformationClient::parseRegions);
    }

    private <T> T callWithRetry(String url, RetryPolicy policy, Function<String, T> parser) {
        if (Schedulers.isInNonBlockingThread()) {
            throw new IllegalStateException("Upstream calls block and cannot run on non-blocking thread "
                    + Thread.currentThread().getName());
        }
        Exception lastException = null;
        int attempts = policy.getMaxAttempts();
        for (int attempt = 0; attempt < attempts; attempt++) {
            if (attempt > 0) {
                long delay = policy.delayMs(attempt - 1);
                log.info("Retrying {} in {} ms (attempt {}/{})", url, delay, attempt + 1, attempts);
                sleepQuietly(delay);
            }
            try {
                acquireThrottlePermit(url);
                log.debug("GET {}", url);
                String body = webClient.get()
                        .uri(url)
                        .retrieve()
                        .bodyToMono(String.class)
                        .block(timeout);
                return parser.apply(body);
            } catch (Exception e) {
                lastException = e;
                log.warn("Upstream attempt {}/{} for {} failed: {}", attempt + 1, attempts, url, messageOf(e));
            }
        }
        throw new UpstreamUnavailableException(
                "Price information API unavailable after " + attempts + " attempts: " + messageOf(lastException),
                attempts, lastException);
    }

    private void acquireThrottlePermit(String url) {
        long start = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - start) / 1_000_000L;
        if (!permitted) {
            throw new IllegalStateException("Upstream throttle timed out after " + waitedMs + " ms before GET " + url);
        }
        if (waitedMs > 0) {
            log.debug("Upstream throttle delayed {} ms before GET {}", waitedMs, url);
        }
    }

    /**
     * Parses {@code {status:"success", data:[{id,name,satuan,today,yesterday,background}]}}.
     *
     * @throws MalformedEnvelopeException when status is not success or data is missing
     */
    static List<PriceSnapshot> parsePriceSnapshots(String json) {
        JsonNode data = successData(json);
        List<PriceSnapshot> out = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            out.add(new PriceSnapshot(
                    intOrNull(item.path("id")),
                    textOrNull(item.path("name")),
                    textOrNull(item.path("satuan")),
                    textOrNull(item.path("background")),
                    decimalOrNull(item.path("today")),
                    decimalOrNull(item.path("yesterday"))));
        }
        return out;
    }

    /** Provinces and cities: {@code data:[{id, nama|name}]}. */
    static List<RegionSnapshot> parseRegions(String json) {
        JsonNode data = successData(json);
        List<RegionSnapshot> out = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            String name = textOrNull(item.path("nama"));
            if (name == null) {
                name = textOrNull(item.path("name"));
            }
            out.add(new RegionSnapshot(intOrNull(item.path("id")), name));
        }
        return out;
    }

    private static JsonNode successData(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedEnvelopeException("Empty response body");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (Exception e) {
            throw new MalformedEnvelopeException("Response is not JSON", e);
        }
        String status = root.path("status").asText("");
        if (!"success".equals(status)) {
            String message = root.path("message").asText("Invalid response");
            throw new MalformedEnvelopeException("API returned error: " + message);
        }
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            throw new MalformedEnvelopeException("Envelope has no data array");
        }
        return data;
    }

    private static Integer intOrNull(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String s = node.asText();
        return s.isBlank() ? null : s.strip();
    }

    private static BigDecimal decimalOrNull(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static void sleepQuietly(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Interrupted while waiting to retry", 0, e);
        }
    }

    private static String messageOf(Throwable t) {
        if (t == null) {
            return "unknown";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
