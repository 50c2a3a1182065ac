package com.hargapangan.ingestion.adapter;

/**
 * Thrown when the price information API could not be reached or kept answering with a malformed
 * envelope after the whole retry budget was spent.
 */
public class UpstreamUnavailableException extends RuntimeException {

    private final int attempts;

    public UpstreamUnavailableException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
