package com.pokeme.store;

/**
 * Thrown when a request is missing a required field or carries a value the broker cannot
 * accept. The message is returned to the caller verbatim.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
