package com.mtg.advisor.source;

/**
 * Exception thrown when the card-data service fails: network errors, error
 * responses, unreadable payloads.
 */
public class CardSourceException extends Exception {
    private final int statusCode;

    public CardSourceException(String message) {
        this(message, -1, null);
    }

    public CardSourceException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public CardSourceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed response, -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
