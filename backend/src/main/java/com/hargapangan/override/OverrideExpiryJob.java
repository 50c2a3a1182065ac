package com.hargapangan.override;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic override expiry sweep (hargapangan.override.expiry-check-interval-ms, default hourly).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OverrideExpiryJob {

    private final OverrideService overrideService;

    @Scheduled(fixedRateString = "${hargapangan.override.expiry-check-interval-ms:3600000}",
            initialDelayString = "${hargapangan.override.expiry-check-interval-ms:3600000}")
    public void run() {
        try {
            int expired = overrideService.expireDue();
            log.debug("Override expiry sweep done: {} expired", expired);
        } catch (Exception e) {
            log.error("Override expiry sweep failed", e);
        }
    }
}
