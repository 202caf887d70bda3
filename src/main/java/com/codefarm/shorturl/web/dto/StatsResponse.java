package com.codefarm.shorturl.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StatsResponse(
        @JsonProperty("total_shortened_urls") long totalShortenedUrls,
        String service,
        String version) {
}
