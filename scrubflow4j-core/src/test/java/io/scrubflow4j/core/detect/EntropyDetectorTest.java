/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EntropyDetectorTest {

    private static final String RANDOM_TOKEN = "xK9mP2nQ8rL5wJ3vF7tH1uD4sA6bC0eG";

    private final EntropyDetector detector = EntropyDetector.defaults();

    @Test
    void flagsRandomMixedCaseToken() {
        assertThat(detector.findHighEntropyTokens("value: " + RANDOM_TOKEN + " end")).containsExactly(RANDOM_TOKEN);
    }

    @Test
    void repeatedTokenIsListedTwice() {
        assertThat(detector.findHighEntropyTokens(RANDOM_TOKEN + " and " + RANDOM_TOKEN))
                .containsExactly(RANDOM_TOKEN, RANDOM_TOKEN);
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "123e4567-e89b-12d3-a456-426614174000",
                "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa",
                "abcdefghijklmnopqrstuvwxyzabcdefghij",
                "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789",
                "short1Aa"
            })
    void ignoresUuidsLowEntropyAndSingleCaseTokens(String text) {
        assertThat(detector.findHighEntropyTokens(text)).isEmpty();
    }

    @Test
    void shannonEntropyOfDistinctAndUniformStrings() {
        assertThat(EntropyDetector.shannonEntropy("")).isZero();
        assertThat(EntropyDetector.shannonEntropy("aaaa")).isZero();
        assertThat(EntropyDetector.shannonEntropy("abcd")).isCloseTo(2.0, within(1e-9));
        assertThat(EntropyDetector.shannonEntropy(RANDOM_TOKEN)).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void looksLikeSecretRejectsDottedStrings() {
        assertThat(EntropyDetector.looksLikeSecret("a1B.c2D.e3F.g4H")).isFalse();
        assertThat(EntropyDetector.looksLikeSecret("a1B.c2D")).isTrue();
    }

    @Test
    void thresholdAndMinLengthAreConfigurable() {
        EntropyDetector lenient = new EntropyDetector(3.0, 16);
        assertThat(lenient.findHighEntropyTokens("key Ab3dEf7hIj9lMn0p")).containsExactly("Ab3dEf7hIj9lMn0p");
        assertThat(detector.findHighEntropyTokens("key Ab3dEf7hIj9lMn0p")).isEmpty();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new EntropyDetector(3.5, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EntropyDetector(-1, 32)).isInstanceOf(IllegalArgumentException.class);
    }
}
