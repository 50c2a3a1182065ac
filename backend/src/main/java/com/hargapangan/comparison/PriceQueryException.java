package com.hargapangan.comparison;

import com.hargapangan.common.ServiceException;

/**
 * Thrown by comparison queries. Codes: COMMODITY_NOT_FOUND, INVALID_RANGE, INVALID_PERIOD.
 */
public class PriceQueryException extends ServiceException {

    public PriceQueryException(String errorCode, String message) {
        super(errorCode, message);
    }
}
