package com.mtg.advisor.source;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.CardNames;
import com.mtg.advisor.config.AdvisorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-bounded cache and request throttle in front of a {@link CardSource}.
 * <p>
 * Each distinct (query, options) pair is memoized for the TTL. Misses wait for the
 * throttle before reaching the delegate. Failures, including unexpected runtime errors
 * from the delegate, are logged and answered with an empty result; they are never
 * cached, so the next call retries.
 */
public class CachingCardSource implements CardSource {
    private static final Logger log = LoggerFactory.getLogger(CachingCardSource.class);

    private record SearchKey(String query, SearchOptions options) {}

    private final CardSource delegate;
    private final RequestThrottle throttle;
    private final Cache<SearchKey, List<Card>> searchCache;
    private final Cache<String, Optional<Card>> namedCache;
    private final AtomicLong outboundRequests = new AtomicLong();

    public CachingCardSource(CardSource delegate, Duration ttl, long maximumSize, RequestThrottle throttle) {
        this(delegate, ttl, maximumSize, throttle, Ticker.systemTicker());
    }

    public CachingCardSource(CardSource delegate, Duration ttl, long maximumSize,
                             RequestThrottle throttle, Ticker ticker) {
        this.delegate = delegate;
        this.throttle = throttle;
        this.searchCache = newCache(ttl, maximumSize, ticker);
        this.namedCache = newCache(ttl, maximumSize, ticker);
    }

    /**
     * Build a cache in front of {@code delegate} using the configured TTL, size and interval.
     */
    public static CachingCardSource create(CardSource delegate, AdvisorConfig config) {
        return new CachingCardSource(delegate, config.cacheTtl(), config.cacheMaximumSize(),
                new RequestThrottle(config.minRequestInterval()));
    }

    private static <K, V> Cache<K, V> newCache(Duration ttl, long maximumSize, Ticker ticker) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    /**
     * Search through the cache. Never throws: a failed request yields an empty list.
     */
    @Override
    public List<Card> search(String query, SearchOptions options) {
        SearchKey key = new SearchKey(query, options);
        List<Card> cached = searchCache.getIfPresent(key);
        if (cached != null) {
            log.debug("Cache hit for query '{}' ({} cards)", query, cached.size());
            return cached;
        }
        try {
            throttle.acquire();
            outboundRequests.incrementAndGet();
            log.debug("Searching card source: {} [{}]", query, options);
            List<Card> cards = List.copyOf(delegate.search(query, options));
            searchCache.put(key, cards);
            return cards;
        } catch (CardSourceException e) {
            log.warn("Card search failed for query '{}': {}", query, e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            log.warn("Unexpected error searching for '{}'", query, e);
            return List.of();
        }
    }

    /**
     * Exact-name lookup through the cache. Never throws: a failed request yields empty.
     */
    @Override
    public Optional<Card> getByName(String name) {
        String key = CardNames.normalize(name);
        Optional<Card> cached = namedCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        try {
            throttle.acquire();
            outboundRequests.incrementAndGet();
            log.debug("Looking up card by name: {}", name);
            Optional<Card> card = delegate.getByName(name);
            namedCache.put(key, card);
            return card;
        } catch (CardSourceException e) {
            log.warn("Card lookup failed for '{}': {}", name, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Unexpected error looking up '{}'", name, e);
            return Optional.empty();
        }
    }

    /**
     * Number of requests that reached the delegate.
     */
    public long getOutboundRequests() {
        return outboundRequests.get();
    }

    public CacheStats searchStats() {
        return searchCache.stats();
    }

    public void invalidateAll() {
        searchCache.invalidateAll();
        namedCache.invalidateAll();
    }
}
