package com.pokeme.client;

/**
 * The broker could not be reached, or refused a call. {@link #statusCode()} is the HTTP
 * status of the refusal, or -1 when no response was received.
 */
public class BrokerClientException extends RuntimeException {

    private final int statusCode;

    public BrokerClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public BrokerClientException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
