package com.hargapangan.ingestion.adapter;

/**
 * Upstream answered but the body is not a success envelope with a data array. Retried like a
 * transport failure.
 */
public class MalformedEnvelopeException extends RuntimeException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
