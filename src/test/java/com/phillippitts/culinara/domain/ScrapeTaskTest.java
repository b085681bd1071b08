package com.phillippitts.culinara.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScrapeTaskTest {

    @Test
    void seedsCanExpandButChildrenCannot() {
        ScrapeTask seed = ScrapeTask.seed("https://example.com/best-soups");
        ScrapeTask child = seed.child("https://example.com/tomato-soup");

        assertThat(seed.depth()).isZero();
        assertThat(seed.canExpand()).isTrue();
        assertThat(child.depth()).isEqualTo(1);
        assertThat(child.canExpand()).isFalse();
    }

    @Test
    void depthIsCappedAtOne() {
        ScrapeTask child = new ScrapeTask("https://example.com/a", ScrapeTask.MAX_DEPTH);

        assertThatThrownBy(() -> child.child("https://example.com/b"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
