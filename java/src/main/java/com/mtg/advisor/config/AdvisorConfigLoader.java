package com.mtg.advisor.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Loads {@link AdvisorConfig} using the hierarchy: env vars > classpath properties > defaults.
 * Command-line overrides are applied by the caller on top of the result.
 */
public class AdvisorConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AdvisorConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "advisor.properties";
    static final String ENV_PREFIX = "MTG_ADVISOR_";

    static final String BASE_URL = "scryfall.base-url";
    static final String USER_AGENT = "scryfall.user-agent";
    static final String TIMEOUT_MS = "scryfall.timeout-ms";
    static final String PAGE_LIMIT = "scryfall.page-limit";
    static final String CACHE_TTL_SECONDS = "cache.ttl-seconds";
    static final String CACHE_MAXIMUM_SIZE = "cache.maximum-size";
    static final String MIN_INTERVAL_MS = "throttle.min-interval-ms";

    private final Map<String, String> environment;

    public AdvisorConfigLoader() {
        this(System.getenv());
    }

    public AdvisorConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public AdvisorConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration, reading the given classpath resource if it exists.
     */
    public AdvisorConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream is = AdvisorConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                properties.load(is);
            } else {
                log.debug("No {} on classpath, using defaults", resource);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
        AdvisorConfig config = fromProperties(properties);
        log.debug("Configuration loaded: {}", config.summary());
        return config;
    }

    AdvisorConfig fromProperties(Properties properties) {
        AdvisorConfig defaults = AdvisorConfig.defaults();
        return new AdvisorConfig(
                value(properties, BASE_URL, defaults.scryfallBaseUrl()),
                value(properties, USER_AGENT, defaults.userAgent()),
                Duration.ofMillis(longValue(properties, TIMEOUT_MS, defaults.requestTimeout().toMillis())),
                (int) longValue(properties, PAGE_LIMIT, defaults.pageLimit()),
                Duration.ofSeconds(longValue(properties, CACHE_TTL_SECONDS, defaults.cacheTtl().toSeconds())),
                longValue(properties, CACHE_MAXIMUM_SIZE, defaults.cacheMaximumSize()),
                Duration.ofMillis(longValue(properties, MIN_INTERVAL_MS, defaults.minRequestInterval().toMillis()))
        );
    }

    /**
     * Env var name for a property key: "cache.ttl-seconds" becomes MTG_ADVISOR_CACHE_TTL_SECONDS.
     */
    static String envName(String key) {
        return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private String value(Properties properties, String key, String fallback) {
        String env = environment.get(envName(key));
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        String prop = properties.getProperty(key);
        return prop != null && !prop.isBlank() ? prop.trim() : fallback;
    }

    private long longValue(Properties properties, String key, long fallback) {
        String raw = value(properties, key, null);
        if (raw == null) {
            return fallback;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": '" + raw + "'", e);
        }
    }
}
