package com.codefarm.shorturl.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RecentUrlsResponse(
        @JsonProperty("recent_urls") List<RecentUrlResponse> recentUrls,
        @JsonProperty("total_count") int totalCount) {
}
