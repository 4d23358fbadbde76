package com.mtg.advisor.source;

import java.util.Locale;

/**
 * Search parameters besides the query text. Part of the cache key, so it is a value type.
 *
 * @param format legality filter, null for none
 * @param order  ordering hint understood by the service
 * @param unique uniqueness mode
 * @param limit  maximum number of cards wanted, capped by the service's page size
 */
public record SearchOptions(String format, Order order, Unique unique, int limit) {

    public static final int DEFAULT_LIMIT = 175;

    public enum Order {
        NAME, EDHREC, CMC, RARITY, RELEASED;

        public String apiValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Unique {
        CARDS, PRINTS, ART;

        public String apiValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public SearchOptions {
        format = format == null || format.isBlank() ? null : format.toLowerCase(Locale.ROOT);
        order = order == null ? Order.NAME : order;
        unique = unique == null ? Unique.CARDS : unique;
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
    }

    public static SearchOptions defaults() {
        return new SearchOptions(null, Order.NAME, Unique.CARDS, DEFAULT_LIMIT);
    }

    public static SearchOptions forFormat(String format, Order order, int limit) {
        return new SearchOptions(format, order, Unique.CARDS, limit);
    }

    public SearchOptions withLimit(int newLimit) {
        return new SearchOptions(format, order, unique, newLimit);
    }
}
