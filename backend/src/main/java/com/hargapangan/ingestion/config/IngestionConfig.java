package com.hargapangan.ingestion.config;

import com.hargapangan.common.RetryPolicy;
import com.hargapangan.ingestion.adapter.PriceInformationClient;
import com.hargapangan.ingestion.adapter.WebClientPriceInformationClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Wires the price information client from hargapangan.upstream and the sync clock from hargapangan.sync.
 */
@Configuration
@EnableConfigurationProperties({ UpstreamProperties.class, SyncProperties.class })
public class IngestionConfig {

    public static final String UPSTREAM_RATE_LIMITER = "upstreamRateLimiter";

    /**
     * One permit per 60000 / requests-per-minute ms, shared by the price, province and city endpoints.
     * A caller waits at most throttle-timeout-ms for its permit.
     */
    @Bean(name = UPSTREAM_RATE_LIMITER)
    public RateLimiter upstreamRateLimiter(UpstreamProperties properties) {
        int perMinute = Math.max(1, properties.getRequestsPerMinute());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMillis(Math.max(1L, 60_000L / perMinute)))
                .limitForPeriod(1)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getThrottleTimeoutMs())))
                .build();
        return RateLimiter.of("bpn-upstream", config);
    }

    @Bean
    public PriceInformationClient priceInformationClient(WebClient.Builder webClientBuilder,
                                                         UpstreamProperties properties,
                                                         @Qualifier(UPSTREAM_RATE_LIMITER) RateLimiter upstreamRateLimiter) {
        return new WebClientPriceInformationClient(
                webClientBuilder,
                properties.getBaseUrl(),
                Duration.ofSeconds(properties.getTimeoutSeconds()),
                toPolicy(properties.getRetry()),
                toPolicy(properties.getRegionRetry()),
                upstreamRateLimiter);
    }

    /** Clock in the sync zone; "today" for the ledger is LocalDate.now(clock). */
    @Bean
    public Clock clock(SyncProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }

    private static RetryPolicy toPolicy(UpstreamProperties.Retry retry) {
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), Math.max(1, retry.getMaxAttempts()));
    }
}
