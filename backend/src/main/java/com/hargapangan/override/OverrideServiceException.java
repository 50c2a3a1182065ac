package com.hargapangan.override;

import com.hargapangan.common.ServiceException;

/**
 * Thrown by OverrideService when the request is invalid or a business rule is violated.
 * API layer maps COMMODITY_NOT_FOUND, NO_CURRENT_PRICE and OVERRIDE_NOT_FOUND to 404, INVALID_DECISION and
 * INVALID_PRICE to 400, OVERRIDE_EXISTS and ALREADY_PROCESSED to 409, SELF_APPROVAL to 403.
 */
public class OverrideServiceException extends ServiceException {

    public OverrideServiceException(String errorCode, String message) {
        super(errorCode, message);
    }
}
