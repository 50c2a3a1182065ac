package com.hargapangan.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Price information API client configuration. Documented in application.yml under hargapangan.upstream.
 */
@ConfigurationProperties(prefix = "hargapangan.upstream")
@NoArgsConstructor
@Getter
@Setter
public class UpstreamProperties {

    /** API base URL; the price, province and city endpoints hang off it. */
    private String baseUrl = "https://api-panelhargav2.badanpangan.go.id/api";

    /** Per-request timeout in seconds. */
    private int timeoutSeconds = 60;

    /** Client-side throttle: max requests per minute across all endpoints. */
    private int requestsPerMinute = 60;

    /** Longest wait in ms for a throttle permit before the attempt counts as failed. */
    private long throttleTimeoutMs = 10_000L;

    /** Retry budget for the price endpoint. */
    private Retry retry = new Retry(2000L, 0.0, 3);

    /** Retry budget for the province and city endpoints. */
    private Retry regionRetry = new Retry(1000L, 0.0, 2);

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Retry {
        /** Delay before the first retry in ms; doubles each further retry. */
        private long baseDelayMs;
        /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
        private double jitterFactor;
        /** Total attempts including the first call. */
        private int maxAttempts;

        public Retry(long baseDelayMs, double jitterFactor, int maxAttempts) {
            this.baseDelayMs = baseDelayMs;
            this.jitterFactor = jitterFactor;
            this.maxAttempts = maxAttempts;
        }
    }
}
