package com.partfinder.exception;

import java.io.IOException;

/**
 * An upstream service (classification oracle, places search, geocoder) could not be
 * reached, timed out, or answered with a non-2xx status.
 */
public class UpstreamUnavailableException extends IOException {

    private final int statusCode;

    public UpstreamUnavailableException(String message) {
        this(message, -1, null);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public UpstreamUnavailableException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
