package com.hargapangan.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Scheduled price sync. Documented in application.yml under hargapangan.sync.
 */
@ConfigurationProperties(prefix = "hargapangan.sync")
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** When false the scheduled trigger does nothing; manual triggers still work. */
    private boolean enabled = true;

    /** Interval between scheduled cycles in ms. Default 6h. */
    private long intervalMs = 21_600_000L;

    /** Delay before the first scheduled cycle after startup in ms. */
    private long initialDelayMs = 30_000L;

    /** Zone whose calendar date is used as the ledger date. */
    private String zone = "Asia/Jakarta";

    /** Upstream province filter; empty means national. */
    private String provinceId = "";

    /** Upstream city filter; empty means all. */
    private String cityId = "";

    /** Upstream level_harga_id: 1=produsen, 2=grosir, 3=konsumen. */
    private int levelHargaId = 3;

    /** Refresh the region list before fetching prices. */
    private boolean syncRegions = true;
}
