package com.hargapangan.api.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-client request limits. Documented in application.yml under hargapangan.ratelimit.
 */
@ConfigurationProperties(prefix = "hargapangan.ratelimit")
@NoArgsConstructor
@Getter
@Setter
public class RateLimitProperties {

    private boolean enabled = true;

    /** All /api/** requests: 100 per 15 minutes per client IP. */
    private Bucket api = new Bucket(100, 900);

    /** POST /api/v1/sync/trigger: 10 per hour per client IP. */
    private Bucket sync = new Bucket(10, 3600);

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Bucket {
        /** Requests allowed per window. */
        private int limit;
        /** Window length in seconds. */
        private long windowSeconds;

        public Bucket(int limit, long windowSeconds) {
            this.limit = limit;
            this.windowSeconds = windowSeconds;
        }
    }
}
