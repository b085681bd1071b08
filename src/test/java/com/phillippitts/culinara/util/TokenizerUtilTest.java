package com.phillippitts.culinara.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerUtilTest {

    @Test
    void shouldTokenizeOnNonAlphaAndLowercase() {
        assertThat(TokenizerUtil.tokenize("2 cups Chopped-Tomatoes, diced!"))
                .containsExactly("cups", "chopped", "tomatoes", "diced");
    }

    @Test
    void shouldReturnEmptyForNullOrBlank() {
        assertThat(TokenizerUtil.tokenize(null)).isEmpty();
        assertThat(TokenizerUtil.tokenize("   ")).isEmpty();
    }

    @Test
    void shouldDropStopWordsFromTerms() {
        assertThat(TokenizerUtil.terms("Easy chicken recipes for dinner"))
                .containsExactly("chicken", "dinner");
    }

    @Test
    void shouldKeepFirstSeenOrderWithoutDuplicates() {
        assertThat(TokenizerUtil.terms("tofu curry tofu x")).containsExactly("tofu", "curry");
    }

    @Test
    void shouldNormalizeTitles() {
        assertThat(TokenizerUtil.normalizeTitle("  Chicken   TIKKA\tMasala ")).isEqualTo("chicken tikka masala");
        assertThat(TokenizerUtil.normalizeTitle(null)).isEmpty();
    }
}
