package com.codefarm.shorturl.util;

import com.codefarm.shorturl.config.ShortenerProperties;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShortCodeGeneratorTest {

    private static final String URL = "https://example.com/very/long/path";

    @RepeatedTest(10)
    void generate_withDefaultProperties_shouldReturnSixAlphanumericCharacters() {
        ShortCodeGenerator generator = new ShortCodeGenerator(new ShortenerProperties());

        String code = generator.generate(URL, 0);

        assertThat(code).hasSize(6);
        assertThat(code).matches("^[A-Za-z0-9]+$");
    }

    @Test
    void generate_firstAttempt_shouldStartWithDigestOfUrl() {
        ShortCodeGenerator generator = new ShortCodeGenerator(6, new Random(42));
        String digest = md5(URL);

        assertThat(generator.generate(URL, 0)).isEqualTo(digest.substring(0, 6));
    }

    @Test
    void generate_retry_shouldHashUrlWithRetryNumberAppended() {
        ShortCodeGenerator generator = new ShortCodeGenerator(8, new Random(42));

        String first = generator.generate(URL, 0);
        String firstRetry = generator.generate(URL, 1);
        String fourthRetry = generator.generate(URL, 4);

        assertThat(firstRetry).isEqualTo(md5(URL + "0").substring(0, 8));
        assertThat(fourthRetry).isEqualTo(md5(URL + "3").substring(0, 8));
        assertThat(firstRetry).isNotEqualTo(first);
    }

    @Test
    void generate_whenLengthCoversRandomSuffix_shouldMixInRandomCharacters() {
        // 32 hex digest characters followed by the 3 random ones
        ShortCodeGenerator generator = new ShortCodeGenerator(35, new Random(7));

        String code = generator.generate(URL, 0);

        assertThat(code).startsWith(md5(URL));
        assertThat(code.substring(32)).hasSize(3).matches("^[A-Za-z0-9]{3}$");
    }

    @Test
    void generate_whenLengthExceedsDigestAndSuffix_shouldPadToExactLength() {
        ShortCodeGenerator generator = new ShortCodeGenerator(50, new Random(7));

        String code = generator.generate(URL, 1);

        assertThat(code).hasSize(50);
        assertThat(code).matches("^[A-Za-z0-9]+$");
    }

    @Test
    void constructor_whenLengthNotPositive_shouldReject() {
        assertThatThrownBy(() -> new ShortCodeGenerator(0, new Random()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Code length");
    }

    private static String md5(String input) {
        return DigestUtils.md5DigestAsHex(input.getBytes(StandardCharsets.UTF_8));
    }
}
