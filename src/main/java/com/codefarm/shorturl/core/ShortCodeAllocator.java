package com.codefarm.shorturl.core;

import com.codefarm.shorturl.config.ShortenerProperties;
import com.codefarm.shorturl.exception.AllocationExhaustedException;
import com.codefarm.shorturl.exception.DuplicateShortCodeException;
import com.codefarm.shorturl.model.UrlRecord;
import com.codefarm.shorturl.util.ShortCodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds a free short code for a URL and stores it.
 *
 * <p>The existence check only skips obvious collisions. The unique constraint on the table is what
 * guarantees uniqueness: a concurrent request that takes the same code makes {@link UrlStore#insert}
 * fail, and the next candidate is tried.
 */
@Component
public class ShortCodeAllocator {

    private static final Logger log = LoggerFactory.getLogger(ShortCodeAllocator.class);

    private final ShortCodeGenerator generator;
    private final UrlStore store;
    private final int maxAttempts;

    public ShortCodeAllocator(ShortCodeGenerator generator, UrlStore store, ShortenerProperties properties) {
        this.generator = generator;
        this.store = store;
        this.maxAttempts = properties.getMaxAttempts();
    }

    public UrlRecord allocate(String longUrl) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String code = generator.generate(longUrl, attempt);
            if (store.exists(code)) {
                log.debug("Short code {} already taken (attempt {})", code, attempt);
                continue;
            }
            try {
                return store.insert(code, longUrl);
            } catch (DuplicateShortCodeException ex) {
                log.debug("Short code {} was taken concurrently (attempt {})", code, attempt);
            }
        }
        log.warn("No free short code for {} after {} attempts", longUrl, maxAttempts);
        throw new AllocationExhaustedException(maxAttempts);
    }
}
