package com.codefarm.shorturl.web.dto;

/**
 * @param timestamp seconds since the epoch, with millisecond precision
 */
public record HealthResponse(String status, double timestamp) {
}
