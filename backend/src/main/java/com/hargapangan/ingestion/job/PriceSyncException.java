package com.hargapangan.ingestion.job;

import com.hargapangan.common.ServiceException;

/**
 * Thrown by PriceSyncJob.triggerNow. Code: SYNC_IN_PROGRESS.
 */
public class PriceSyncException extends ServiceException {

    public PriceSyncException(String errorCode, String message) {
        super(errorCode, message);
    }
}
