package com.mtg.advisor.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime settings for the card-data client, its cache and its throttle.
 */
public record AdvisorConfig(
    String scryfallBaseUrl,
    String userAgent,
    Duration requestTimeout,
    int pageLimit,
    Duration cacheTtl,
    long cacheMaximumSize,
    Duration minRequestInterval
) {
    public static final String DEFAULT_BASE_URL = "https://api.scryfall.com";
    public static final String DEFAULT_USER_AGENT = "mtg-deck-advisor/1.0";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_PAGE_LIMIT = 175;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);
    public static final long DEFAULT_CACHE_MAXIMUM_SIZE = 2000;
    public static final Duration DEFAULT_MIN_REQUEST_INTERVAL = Duration.ofMillis(100);

    public AdvisorConfig {
        Objects.requireNonNull(scryfallBaseUrl, "scryfallBaseUrl");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(cacheTtl, "cacheTtl");
        Objects.requireNonNull(minRequestInterval, "minRequestInterval");
        if (pageLimit < 1) {
            throw new IllegalArgumentException("pageLimit must be positive: " + pageLimit);
        }
        if (cacheMaximumSize < 1) {
            throw new IllegalArgumentException("cacheMaximumSize must be positive: " + cacheMaximumSize);
        }
        if (minRequestInterval.isNegative()) {
            throw new IllegalArgumentException("minRequestInterval cannot be negative");
        }
        // Trailing slash would double up when joining endpoint paths
        while (scryfallBaseUrl.endsWith("/")) {
            scryfallBaseUrl = scryfallBaseUrl.substring(0, scryfallBaseUrl.length() - 1);
        }
    }

    public static AdvisorConfig defaults() {
        return new AdvisorConfig(DEFAULT_BASE_URL, DEFAULT_USER_AGENT, DEFAULT_TIMEOUT, DEFAULT_PAGE_LIMIT,
                DEFAULT_CACHE_TTL, DEFAULT_CACHE_MAXIMUM_SIZE, DEFAULT_MIN_REQUEST_INTERVAL);
    }

    public AdvisorConfig withBaseUrl(String baseUrl) {
        return new AdvisorConfig(baseUrl, userAgent, requestTimeout, pageLimit, cacheTtl,
                cacheMaximumSize, minRequestInterval);
    }

    public AdvisorConfig withMinRequestInterval(Duration interval) {
        return new AdvisorConfig(scryfallBaseUrl, userAgent, requestTimeout, pageLimit, cacheTtl,
                cacheMaximumSize, interval);
    }

    public String summary() {
        return String.format("baseUrl=%s, timeout=%dms, pageLimit=%d, cacheTtl=%ds, cacheSize=%d, minInterval=%dms",
                scryfallBaseUrl, requestTimeout.toMillis(), pageLimit, cacheTtl.toSeconds(),
                cacheMaximumSize, minRequestInterval.toMillis());
    }
}
