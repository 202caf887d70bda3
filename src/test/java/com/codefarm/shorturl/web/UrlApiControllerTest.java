package com.codefarm.shorturl.web;

import com.codefarm.shorturl.core.UrlShortenerService;
import com.codefarm.shorturl.web.dto.ShortenRequest;
import com.codefarm.shorturl.web.dto.ShortenResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Request mapping and error translation, with the service mocked out.
 */
@WebMvcTest(controllers = {UrlApiController.class, RedirectController.class})
class UrlApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UrlShortenerService service;

    @MockBean
    private BaseUrlResolver baseUrlResolver;

    @BeforeEach
    void setUp() {
        when(baseUrlResolver.resolve(any())).thenReturn("http://sho.rt");
    }

    @Test
    void postShorten_shouldPassBodyAndResolvedBaseUrlToService() throws Exception {
        when(service.shortenUrl(new ShortenRequest("https://example.com"), "http://sho.rt"))
                .thenReturn(new ShortenResponse("abc123", "http://sho.rt/abc123", "https://example.com"));

        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://example.com\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.short_code", is("abc123")))
                .andExpect(jsonPath("$.short_url", is("http://sho.rt/abc123")))
                .andExpect(jsonPath("$.long_url", is("https://example.com")));
    }

    @Test
    void postShorten_whenStorageFails_shouldHideDetailsBehindGenericError() throws Exception {
        when(service.shortenUrl(any(), eq("http://sho.rt")))
                .thenThrow(new DataAccessResourceFailureException("jdbc:h2:file:/secret/path is locked"));

        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://example.com\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", is("Internal server error")));
    }

    @Test
    void postShorten_whenContentTypeNotJson_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("https://example.com"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("URL is required")));

        verifyNoInteractions(service);
    }

    @Test
    void postShorten_whenJsonMalformed_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("URL is required")));

        verifyNoInteractions(service);
    }

    @Test
    void getCode_whenKnown_shouldRedirectWithFound() throws Exception {
        when(service.resolve("abc123")).thenReturn("https://example.com/target?a=1&b=2");

        mockMvc.perform(get("/abc123"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "https://example.com/target?a=1&b=2"));
    }

    @Test
    void getCode_whenUnexpectedFailure_shouldReturnGenericServerError() throws Exception {
        when(service.resolve("boom00")).thenThrow(new IllegalStateException("connection pool exhausted"));

        mockMvc.perform(get("/boom00"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", is("Internal server error")));
    }
}
