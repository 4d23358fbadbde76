package com.mtg.advisor.card;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fixed keyword vocabulary detected in oracle text by substring match.
 * Evergreen abilities come first, followed by derived effects (card draw, removal, ...).
 */
public enum CardKeyword {
    HASTE("haste", "haste"),
    FLYING("flying", "flying"),
    TRAMPLE("trample", "trample"),
    DEATHTOUCH("deathtouch", "deathtouch"),
    LIFELINK("lifelink", "lifelink"),
    VIGILANCE("vigilance", "vigilance"),
    FIRST_STRIKE("first strike", "first strike"),
    DOUBLE_STRIKE("double strike", "double strike"),
    FLASH("flash", "flash"),
    PROWESS("prowess", "prowess"),
    HEXPROOF("hexproof", "hexproof"),
    WARD("ward", "ward"),
    MENACE("menace", "menace"),
    REACH("reach", "reach"),
    INDESTRUCTIBLE("indestructible", "indestructible"),
    CARD_DRAW("card draw", "draw"),
    COUNTERSPELL("counterspell", "counter target"),
    REMOVAL("removal", "destroy target", "exile target", "destroy all", "exile all"),
    RAMP("ramp", "add {", "search your library for a basic land", "search your library for a land",
            "additional land"),
    TUTOR("tutor", "search your library for a card", "search your library for a creature",
            "search your library for an instant", "search your library for a sorcery",
            "search your library for an artifact", "search your library for an enchantment",
            "search your library for a planeswalker"),
    SACRIFICE("sacrifice", "sacrifice"),
    GRAVEYARD("graveyard", "graveyard"),
    LIFEGAIN("lifegain", "gain life", "gains life", "you gain"),
    ENTERS("enters", "enters the battlefield", "enters,", "enters tapped", "when this creature enters");

    private final String label;
    private final List<String> patterns;

    CardKeyword(String label, String... patterns) {
        this.label = label;
        this.patterns = List.of(patterns);
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public boolean matches(String lowerText) {
        for (String pattern : patterns) {
            if (lowerText.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extract every keyword present in the given oracle text, in declaration order.
     */
    public static List<CardKeyword> extract(String oracleText) {
        if (oracleText == null || oracleText.isEmpty()) {
            return List.of();
        }
        String text = oracleText.toLowerCase(Locale.ROOT);
        List<CardKeyword> keywords = new ArrayList<>();
        for (CardKeyword keyword : values()) {
            if (keyword.matches(text)) {
                keywords.add(keyword);
            }
        }
        return List.copyOf(keywords);
    }
}
