package com.phillippitts.culinara.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the query response cache.
 */
@Validated
@ConfigurationProperties(prefix = "culinara.cache")
public class CacheProperties {

    private final boolean enabled;

    @Min(1)
    private final long ttlSeconds;

    @Min(1)
    private final int maxEntries;

    @ConstructorBinding
    public CacheProperties(Boolean enabled, Long ttlSeconds, Integer maxEntries) {
        this.enabled = enabled == null || enabled;
        this.ttlSeconds = ttlSeconds == null ? 3600L : ttlSeconds;
        this.maxEntries = maxEntries == null ? 500 : maxEntries;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public int getMaxEntries() {
        return maxEntries;
    }
}
