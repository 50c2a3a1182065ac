package com.hargapangan.common;

import lombok.Getter;

/**
 * Base for business-rule failures raised by services. The API layer maps {@link #getErrorCode()} to an
 * HTTP status and an ErrorBody.
 */
@Getter
public abstract class ServiceException extends RuntimeException {

    private final String errorCode;

    protected ServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
