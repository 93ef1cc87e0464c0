package com.vidnyan.bridge.application.port.out;

/**
 * Thrown when an interchange document cannot be loaded back into nodes.
 */
public class InterchangeFormatException extends RuntimeException {

    public InterchangeFormatException(String message) {
        super(message);
    }

    public InterchangeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
