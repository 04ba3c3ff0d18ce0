package com.resumetailor.infrastructure.optimization.enhancement;

import com.resumetailor.domain.optimization.model.Keyword;
import com.resumetailor.infrastructure.optimization.keyword.KeywordMatcher;
import com.resumetailor.infrastructure.optimization.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DensityGuardTest {

    private static final Keyword DOCKER = new Keyword("Docker", 1);

    private DensityGuard guard;

    @BeforeEach
    void setUp() {
        guard = new DensityGuard(new KeywordMatcher(new TextNormalizer()));
    }

    private static String words(int count) {
        return String.join(" ", Collections.nCopies(count, "word"));
    }

    @Test
    @DisplayName("Blocks under ten words are always allowed")
    void short_block_allowed() {
        assertThat(guard.allowsInsertion("Docker Docker Docker", DOCKER, 0.03)).isTrue();
        assertThat(guard.allowsInsertion(words(9), DOCKER, 0.03)).isTrue();
    }

    @Test
    @DisplayName("12-word block: 1/13 exceeds 3%")
    void medium_block_blocked() {
        assertThat(guard.allowsInsertion(words(12), DOCKER, 0.03)).isFalse();
    }

    @Test
    @DisplayName("40-word block: 1/41 stays under 3%")
    void long_block_allowed() {
        assertThat(guard.allowsInsertion(words(40), DOCKER, 0.03)).isTrue();
    }

    @Test
    @DisplayName("Existing occurrences count toward the limit")
    void existing_occurrence_counts() {
        assertThat(guard.allowsInsertion(words(39) + " Docker", DOCKER, 0.03)).isFalse();
    }

    @Test
    @DisplayName("Limit is a parameter")
    void custom_limit() {
        assertThat(guard.allowsInsertion(words(12), DOCKER, 0.1)).isTrue();
    }

    @Test
    @DisplayName("density = occurrences / words")
    void density() {
        assertThat(guard.density("Docker and more Docker", "docker")).isCloseTo(0.5, within(1e-9));
        assertThat(guard.density("", "docker")).isZero();
    }
}
