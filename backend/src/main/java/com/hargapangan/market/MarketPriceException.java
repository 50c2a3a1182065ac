package com.hargapangan.market;

import com.hargapangan.common.ServiceException;

/**
 * Thrown by the market report and custom commodity services. Codes: VALIDATION_FAILED,
 * COMMODITY_NOT_FOUND, REPORT_NOT_FOUND, CUSTOM_COMMODITY_NOT_FOUND, CUSTOM_COMMODITY_EXISTS, FORBIDDEN.
 */
public class MarketPriceException extends ServiceException {

    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    public static final String COMMODITY_NOT_FOUND = "COMMODITY_NOT_FOUND";
    public static final String REPORT_NOT_FOUND = "REPORT_NOT_FOUND";
    public static final String CUSTOM_COMMODITY_NOT_FOUND = "CUSTOM_COMMODITY_NOT_FOUND";
    public static final String CUSTOM_COMMODITY_EXISTS = "CUSTOM_COMMODITY_EXISTS";
    public static final String FORBIDDEN = "FORBIDDEN";

    public MarketPriceException(String errorCode, String message) {
        super(errorCode, message);
    }
}
