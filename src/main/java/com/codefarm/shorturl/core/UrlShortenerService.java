package com.codefarm.shorturl.core;

import com.codefarm.shorturl.web.dto.RecentUrlsResponse;
import com.codefarm.shorturl.web.dto.ShortenRequest;
import com.codefarm.shorturl.web.dto.ShortenResponse;
import com.codefarm.shorturl.web.dto.StatsResponse;

public interface UrlShortenerService {
    ShortenResponse shortenUrl(ShortenRequest request, String requestBaseUrl);
    String resolve(String shortCode);
    StatsResponse stats();
    RecentUrlsResponse recentUrls(String requestBaseUrl);
}
