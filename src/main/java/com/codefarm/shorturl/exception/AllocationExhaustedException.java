package com.codefarm.shorturl.exception;

public class AllocationExhaustedException extends RuntimeException {

    private final int attempts;

    public AllocationExhaustedException(int attempts) {
        super("Failed to generate unique short code");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
