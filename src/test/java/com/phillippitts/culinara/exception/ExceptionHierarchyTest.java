package com.phillippitts.culinara.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsAreUnchecked() {
        assertThat(new CulinaraException("x")).isInstanceOf(RuntimeException.class);
        assertThat(new InvalidQueryException("x")).isInstanceOf(CulinaraException.class);
        assertThat(new FetchTimeoutException("https://example.com", 10)).isInstanceOf(FetchException.class);
        assertThat(new ProviderTimeoutException("primary", 10)).isInstanceOf(ProviderException.class);
    }

    @Test
    void sourceExceptionsNameTheirSource() {
        assertThat(new EmbeddingUnavailableException("down").getSourceName()).isEqualTo("embedding");
        assertThat(new StoreUnavailableException("down").getSourceName()).isEqualTo("vector-store");
        assertThat(new SearchUnavailableException("down").getSourceName()).isEqualTo("web-search");
        assertThat(new StoreUnavailableException("down")).isInstanceOf(SourceUnavailableException.class);
    }

    @Test
    void messagesCarryContext() {
        InvalidQueryException invalid = new InvalidQueryException("query text is empty");
        assertThat(invalid.getReason()).isEqualTo("query text is empty");
        assertThat(invalid.getMessage()).isEqualTo("Invalid query: query text is empty");

        FetchTimeoutException timeout = new FetchTimeoutException("https://example.com/soup", 1500);
        assertThat(timeout.getUrl()).isEqualTo("https://example.com/soup");
        assertThat(timeout.getTimeoutMs()).isEqualTo(1500);
        assertThat(timeout.getMessage()).contains("1500ms").contains("https://example.com/soup");

        ProviderException provider = new ProviderException("boom", "secondary");
        assertThat(provider.getProviderId()).isEqualTo("secondary");
        assertThat(provider.getMessage()).contains("(provider: secondary)");
    }

    @Test
    void causesArePreserved() {
        IllegalStateException cause = new IllegalStateException("socket closed");

        assertThat(new StoreUnavailableException("down", cause).getCause()).isSameAs(cause);
        assertThat(new FetchException("failed", "https://example.com", cause).getCause()).isSameAs(cause);
    }
}
