package com.partfinder.exception;

import java.io.IOException;

/**
 * An upstream answered, but its payload could not be parsed into the expected shape.
 */
public class MalformedResponseException extends IOException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
