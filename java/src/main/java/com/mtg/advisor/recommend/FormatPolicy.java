package com.mtg.advisor.recommend;

import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.ColorFlags;

import java.util.Locale;
import java.util.Set;

/**
 * Color rules by format family. Singleton formats bind a deck to its commander's
 * color identity; constructed formats only care about the colors in a card's cost.
 */
public enum FormatPolicy {
    SINGLETON,
    CONSTRUCTED;

    private static final Set<String> SINGLETON_FORMATS = Set.of(
        "commander", "edh", "brawl", "standardbrawl", "oathbreaker", "duel", "paupercommander");

    public static FormatPolicy forFormat(String format) {
        if (format == null) {
            return CONSTRUCTED;
        }
        return SINGLETON_FORMATS.contains(format.trim().toLowerCase(Locale.ROOT)) ? SINGLETON : CONSTRUCTED;
    }

    public boolean isSingleton() {
        return this == SINGLETON;
    }

    /**
     * The colors this policy checks against the deck: identity for singleton, cost colors otherwise.
     */
    public ColorFlags relevantColors(Card card) {
        return this == SINGLETON ? card.getColorIdentity() : card.getColors();
    }

    /**
     * Whether the card may be played alongside the deck's colors. A deck with no colors
     * anchors nothing, so every card is compatible with it.
     */
    public boolean isColorCompatible(Card card, ColorFlags deckColors) {
        if (deckColors.isEmpty()) {
            return true;
        }
        return relevantColors(card).isSubsetOf(deckColors);
    }
}
