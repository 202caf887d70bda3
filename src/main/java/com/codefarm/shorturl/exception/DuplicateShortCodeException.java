package com.codefarm.shorturl.exception;

/**
 * Raised when an insert violates the unique constraint on the short code column.
 */
public class DuplicateShortCodeException extends RuntimeException {

    private final String shortCode;

    public DuplicateShortCodeException(String shortCode, Throwable cause) {
        super("Short code already in use: " + shortCode, cause);
        this.shortCode = shortCode;
    }

    public String getShortCode() {
        return shortCode;
    }
}
