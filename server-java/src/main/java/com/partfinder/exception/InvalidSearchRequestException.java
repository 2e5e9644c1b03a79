package com.partfinder.exception;

/**
 * The caller's request cannot be served: missing or invalid location, missing part,
 * or a bad distance budget. This is the only error the store locator surfaces.
 */
public class InvalidSearchRequestException extends IllegalArgumentException {

    public InvalidSearchRequestException(String message) {
        super(message);
    }
}
