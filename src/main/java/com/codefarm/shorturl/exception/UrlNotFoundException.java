package com.codefarm.shorturl.exception;

public class UrlNotFoundException extends RuntimeException {

    private final String shortCode;

    public UrlNotFoundException(String shortCode) {
        super("Short URL not found");
        this.shortCode = shortCode;
    }

    public String getShortCode() {
        return shortCode;
    }
}
