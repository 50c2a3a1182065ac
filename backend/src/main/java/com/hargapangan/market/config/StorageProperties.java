package com.hargapangan.market.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Evidence file storage. Documented in application.yml under hargapangan.storage.
 */
@ConfigurationProperties(prefix = "hargapangan.storage")
@NoArgsConstructor
@Getter
@Setter
public class StorageProperties {

    /** Directory holding market evidence images; references are paths relative to it. */
    private String uploadDir = "uploads/market-images";
}
