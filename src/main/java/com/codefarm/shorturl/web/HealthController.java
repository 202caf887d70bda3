package com.codefarm.shorturl.web;

import com.codefarm.shorturl.web.dto.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", System.currentTimeMillis() / 1000.0);
    }
}
