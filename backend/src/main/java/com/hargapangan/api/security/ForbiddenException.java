package com.hargapangan.api.security;

import com.hargapangan.common.ServiceException;

/**
 * Caller role is not allowed to perform the operation. Mapped to 403.
 */
public class ForbiddenException extends ServiceException {

    public static final String FORBIDDEN = "FORBIDDEN";

    public ForbiddenException(String message) {
        super(FORBIDDEN, message);
    }
}
