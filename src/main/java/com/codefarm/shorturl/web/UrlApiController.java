package com.codefarm.shorturl.web;

import com.codefarm.shorturl.core.UrlShortenerService;
import com.codefarm.shorturl.web.dto.RecentUrlsResponse;
import com.codefarm.shorturl.web.dto.ShortenRequest;
import com.codefarm.shorturl.web.dto.ShortenResponse;
import com.codefarm.shorturl.web.dto.StatsResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
public class UrlApiController {

    private final UrlShortenerService service;
    private final BaseUrlResolver baseUrlResolver;

    public UrlApiController(UrlShortenerService service, BaseUrlResolver baseUrlResolver) {
        this.service = service;
        this.baseUrlResolver = baseUrlResolver;
    }

    @PostMapping("/shorten")
    public ResponseEntity<ShortenResponse> shorten(@RequestBody ShortenRequest request,
                                                   HttpServletRequest httpRequest) {
        ShortenResponse response = service.shortenUrl(request, baseUrlResolver.resolve(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(service.stats());
    }

    @GetMapping("/list")
    public ResponseEntity<RecentUrlsResponse> list(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(service.recentUrls(baseUrlResolver.resolve(httpRequest)));
    }
}
