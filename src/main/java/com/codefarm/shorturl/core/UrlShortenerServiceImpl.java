package com.codefarm.shorturl.core;

import com.codefarm.shorturl.config.ShortenerProperties;
import com.codefarm.shorturl.exception.InvalidUrlException;
import com.codefarm.shorturl.exception.UrlNotFoundException;
import com.codefarm.shorturl.model.UrlRecord;
import com.codefarm.shorturl.web.dto.RecentUrlResponse;
import com.codefarm.shorturl.web.dto.RecentUrlsResponse;
import com.codefarm.shorturl.web.dto.ShortenRequest;
import com.codefarm.shorturl.web.dto.ShortenResponse;
import com.codefarm.shorturl.web.dto.StatsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class UrlShortenerServiceImpl implements UrlShortenerService {

    private static final Logger log = LoggerFactory.getLogger(UrlShortenerServiceImpl.class);

    private final UrlStore store;
    private final ShortCodeAllocator allocator;
    private final ShortenerProperties properties;

    public UrlShortenerServiceImpl(UrlStore store, ShortCodeAllocator allocator, ShortenerProperties properties) {
        this.store = store;
        this.allocator = allocator;
        this.properties = properties;
    }

    @Override
    public ShortenResponse shortenUrl(ShortenRequest request, String requestBaseUrl) {
        String longUrl = validateUrl(request == null ? null : request.url());

        UrlRecord record = allocator.allocate(longUrl);
        log.info("Shortened URL: {} -> {}", longUrl, record.getShortCode());
        return new ShortenResponse(record.getShortCode(), buildShortUrl(requestBaseUrl, record.getShortCode()), longUrl);
    }

    @Override
    public String resolve(String shortCode) {
        String longUrl = store.lookup(shortCode)
                .orElseThrow(() -> new UrlNotFoundException(shortCode));
        log.info("Redirecting {} -> {}", shortCode, longUrl);
        return longUrl;
    }

    @Override
    public StatsResponse stats() {
        return new StatsResponse(store.count(), properties.getServiceName(), properties.getVersion());
    }

    @Override
    public RecentUrlsResponse recentUrls(String requestBaseUrl) {
        List<RecentUrlResponse> urls = store.recent(properties.getRecentLimit()).stream()
                .map(r -> new RecentUrlResponse(r.getShortCode(), r.getLongUrl(), r.getCreatedAt(),
                        buildShortUrl(requestBaseUrl, r.getShortCode())))
                .toList();
        return new RecentUrlsResponse(urls, urls.size());
    }

    private static String validateUrl(String url) {
        if (url == null) {
            throw new InvalidUrlException("URL is required");
        }
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new InvalidUrlException("URL must start with http:// or https://");
        }
        return url;
    }

    private static String buildShortUrl(String baseUrl, String shortCode) {
        String normalized = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        return normalized + shortCode;
    }
}
