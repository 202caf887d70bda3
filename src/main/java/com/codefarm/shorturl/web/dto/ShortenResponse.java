package com.codefarm.shorturl.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ShortenResponse(
        @JsonProperty("short_code") String shortCode,
        @JsonProperty("short_url") String shortUrl,
        @JsonProperty("long_url") String longUrl) {
}
