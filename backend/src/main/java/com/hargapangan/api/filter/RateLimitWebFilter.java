package com.hargapangan.api.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hargapangan.api.config.RateLimitProperties;
import com.hargapangan.api.dto.ErrorBody;
import com.hargapangan.api.security.ActorResolver;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Per client IP request limits using resilience4j rate limiters: the api bucket for every /api/** call
 * and the sync bucket additionally for manual sync triggers. Exhausted buckets answer 429 with ErrorBody.
 */
@Component
@Order(-100)
@Slf4j
public class RateLimitWebFilter implements WebFilter {

    public static final String RATE_LIMITED = "RATE_LIMITED";
    static final String SYNC_TRIGGER_PATH = "/api/v1/sync/trigger";

    private final RateLimitProperties properties;
    private final ObjectMapper objectMapper;
    private final RateLimiterConfig apiConfig;
    private final RateLimiterConfig syncConfig;
    private final Cache<String, RateLimiter> limiters;

    public RateLimitWebFilter(RateLimitProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.apiConfig = toConfig(properties.getApi());
        this.syncConfig = toConfig(properties.getSync());
        long maxWindow = Math.max(properties.getApi().getWindowSeconds(), properties.getSync().getWindowSeconds());
        this.limiters = Caffeine.newBuilder()
                .expireAfterAccess(Math.max(60L, maxWindow), TimeUnit.SECONDS)
                .maximumSize(50_000)
                .build();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().pathWithinApplication().value();
        if (!properties.isEnabled() || !path.startsWith("/api/")) {
            return chain.filter(exchange);
        }
        String ip = ActorResolver.clientIp(request);
        if (!limiter("api:" + ip, apiConfig).acquirePermission()) {
            log.warn("Rate limit (api) exceeded for {}", ip);
            return reject(exchange, "Too many requests, please try again later");
        }
        if (HttpMethod.POST.equals(request.getMethod()) && SYNC_TRIGGER_PATH.equals(path)
                && !limiter("sync:" + ip, syncConfig).acquirePermission()) {
            log.warn("Rate limit (sync) exceeded for {}", ip);
            return reject(exchange, "Too many sync requests, please try again later");
        }
        return chain.filter(exchange);
    }

    private RateLimiter limiter(String key, RateLimiterConfig config) {
        return limiters.get(key, k -> RateLimiter.of(k, config));
    }

    private Mono<Void> reject(ServerWebExchange exchange, String message) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(ErrorBody.of(RATE_LIMITED, message));
        } catch (Exception e) {
            body = ("{\"error\":\"" + RATE_LIMITED + "\"}").getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }

    private static RateLimiterConfig toConfig(RateLimitProperties.Bucket bucket) {
        return RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(Math.max(1L, bucket.getWindowSeconds())))
                .limitForPeriod(Math.max(1, bucket.getLimit()))
                .timeoutDuration(Duration.ZERO)
                .build();
    }
}
