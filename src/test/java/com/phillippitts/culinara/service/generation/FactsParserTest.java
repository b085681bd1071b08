package com.phillippitts.culinara.service.generation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FactsParserTest {

    @Test
    void stripsBulletsAndNumbering() {
        String text = """
                1. Paneer does not melt when heated.
                - Turmeric has been used for 4,000 years.
                * Chickpeas are also called garbanzo beans.
                """;

        assertThat(FactsParser.parse(text, 5)).containsExactly(
                "Paneer does not melt when heated.",
                "Turmeric has been used for 4,000 years.",
                "Chickpeas are also called garbanzo beans.");
    }

    @Test
    void dropsBlankLinesAndCapsCount() {
        String text = "First\n\n\nSecond\r\nThird\nFourth";

        assertThat(FactsParser.parse(text, 3)).containsExactly("First", "Second", "Third");
    }

    @Test
    void emptyInputYieldsNoFacts() {
        assertThat(FactsParser.parse(null, 3)).isEmpty();
        assertThat(FactsParser.parse("   ", 3)).isEmpty();
        assertThat(FactsParser.parse("fact", 0)).isEmpty();
    }
}
