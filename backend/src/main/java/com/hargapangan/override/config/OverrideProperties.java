package com.hargapangan.override.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Override approval and expiry. Documented in application.yml under hargapangan.override.
 */
@ConfigurationProperties(prefix = "hargapangan.override")
@NoArgsConstructor
@Getter
@Setter
public class OverrideProperties {

    /** Changes strictly above this percentage need approval unless the requester is an admin. */
    private BigDecimal approvalThresholdPct = BigDecimal.valueOf(50);

    /** Lifetime of an override from creation, in hours. */
    private int ttlHours = 24;

    /** Interval of the expiry sweep in ms. Default 1h. */
    private long expiryCheckIntervalMs = 3_600_000L;
}
