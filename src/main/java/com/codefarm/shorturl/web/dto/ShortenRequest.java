package com.codefarm.shorturl.web.dto;

public record ShortenRequest(String url) {
}
