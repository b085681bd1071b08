package com.phillippitts.culinara.service.cache;

import com.phillippitts.culinara.config.properties.CacheProperties;
import com.phillippitts.culinara.domain.Preferences;
import com.phillippitts.culinara.domain.Query;
import com.phillippitts.culinara.domain.QueryResponse;
import com.phillippitts.culinara.util.TokenizerUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory TTL cache of answered queries.
 *
 * <p>Keys combine the normalized query text with every preference that shapes the answer: the
 * sorted, lower-cased diet labels, skill level, servings and goal. "Chicken  Curry" and
 * "chicken curry" share an entry while the same text with a different diet or serving count
 * does not. Only responses with at least one candidate are stored. When the cache is full the
 * entry closest to expiry is evicted.
 */
@Component
public class ResponseCache {
    private static final Logger LOG = LogManager.getLogger(ResponseCache.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final boolean enabled;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    @Autowired
    public ResponseCache(CacheProperties props) {
        this(props.isEnabled(), Duration.ofSeconds(props.getTtlSeconds()), props.getMaxEntries(),
                Clock.systemUTC());
    }

    public ResponseCache(boolean enabled, Duration ttl, int maxEntries, Clock clock) {
        this.enabled = enabled;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * A cache that never stores anything.
     */
    public static ResponseCache disabled() {
        return new ResponseCache(false, Duration.ZERO, 1, Clock.systemUTC());
    }

    public Optional<QueryResponse> get(Query query) {
        if (!enabled) {
            return Optional.empty();
        }
        String key = key(query);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.response());
    }

    public void put(Query query, QueryResponse response) {
        if (!enabled || response == null || !response.hasCandidates()) {
            return;
        }
        if (entries.size() >= maxEntries) {
            evictOne();
        }
        entries.put(key(query), new Entry(response, clock.instant().plus(ttl)));
    }

    /**
     * Drops expired entries. Runs periodically; lookups also drop expired entries lazily.
     */
    @Scheduled(fixedRate = 300_000)
    public void evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> e.isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            LOG.debug("Evicted {} expired response(s)", removed);
        }
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    static String key(Query query) {
        String diets = query.preferences().diets().stream()
                .map(d -> d.toLowerCase(Locale.ROOT).trim())
                .sorted()
                .collect(Collectors.joining(","));
        Preferences p = query.preferences();
        return TokenizerUtil.normalizeTitle(query.text())
                + "|" + diets
                + "|" + TokenizerUtil.normalizeTitle(p.skillLevel())
                + "|" + (p.servings() == null ? "" : p.servings())
                + "|" + TokenizerUtil.normalizeTitle(p.goal());
    }

    private void evictOne() {
        entries.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().expiresAt()))
                .ifPresent(e -> entries.remove(e.getKey(), e.getValue()));
    }

    private record Entry(QueryResponse response, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }
}
