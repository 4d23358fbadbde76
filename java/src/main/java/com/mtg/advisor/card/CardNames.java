package com.mtg.advisor.card;

import java.util.Locale;

/**
 * Card name normalization. Names are unique case-insensitively, so every
 * name-keyed lookup (deck membership, collection, dedup) goes through {@link #normalize}.
 */
public final class CardNames {
    private CardNames() {}

    public static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Basic lands are exempt from the playset limit and never recommended.
     */
    public static boolean isBasicLand(String typeLine) {
        return typeLine != null && typeLine.toLowerCase(Locale.ROOT).contains("basic")
                && typeLine.toLowerCase(Locale.ROOT).contains("land");
    }
}
