package com.codefarm.shorturl.web;

import com.codefarm.shorturl.config.ShortenerProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

@Component
public class BaseUrlResolver {

    private final String configuredBaseUrl;

    public BaseUrlResolver(ShortenerProperties properties) {
        String baseUrl = properties.getBaseUrl();
        this.configuredBaseUrl = baseUrl == null ? "" : baseUrl.trim();
    }

    public String resolve(HttpServletRequest request) {
        if (!configuredBaseUrl.isEmpty()) {
            return configuredBaseUrl;
        }
        String scheme = request.getScheme();
        String host = request.getServerName();
        int port = request.getServerPort();
        boolean isDefault = (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
        return scheme + "://" + host + (isDefault ? "" : (":" + port));
    }
}
