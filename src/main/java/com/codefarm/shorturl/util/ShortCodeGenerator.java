package com.codefarm.shorturl.util;

import com.codefarm.shorturl.config.ShortenerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Random;

@Component
public class ShortCodeGenerator {

    static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final int RANDOM_SUFFIX_LENGTH = 3;

    private final int length;
    private final Random random;

    @Autowired
    public ShortCodeGenerator(ShortenerProperties properties) {
        this(properties.getCodeLength(), new SecureRandom());
    }

    ShortCodeGenerator(int length, Random random) {
        if (length < 1) {
            throw new IllegalArgumentException("Code length must be positive");
        }
        this.length = length;
        this.random = random;
    }

    public String generate(String url, int attempt) {
        // retries are numbered from 0: the second candidate hashes url + "0"
        String input = attempt == 0 ? url : url + (attempt - 1);
        String hash = DigestUtils.md5DigestAsHex(input.getBytes(StandardCharsets.UTF_8));

        StringBuilder builder = new StringBuilder(Math.max(length, hash.length() + RANDOM_SUFFIX_LENGTH));
        builder.append(hash);
        appendRandom(builder, RANDOM_SUFFIX_LENGTH);
        // codes longer than digest + suffix
        if (builder.length() < length) {
            appendRandom(builder, length - builder.length());
        }
        return builder.substring(0, length);
    }

    public int getLength() {
        return length;
    }

    private void appendRandom(StringBuilder builder, int count) {
        for (int i = 0; i < count; i++) {
            builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
    }
}
