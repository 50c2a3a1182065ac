package com.hargapangan.ingestion.registry;

import com.hargapangan.common.ServiceException;

/**
 * Thrown by CommodityAdminService. Codes: COMMODITY_NOT_FOUND, INVALID_COMMODITY, COMMODITY_EXISTS.
 */
public class CommodityServiceException extends ServiceException {

    public CommodityServiceException(String errorCode, String message) {
        super(errorCode, message);
    }
}
