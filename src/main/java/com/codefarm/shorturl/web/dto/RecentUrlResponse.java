package com.codefarm.shorturl.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record RecentUrlResponse(
        @JsonProperty("short_code") String shortCode,
        @JsonProperty("long_url") String longUrl,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("short_url") String shortUrl) {
}
