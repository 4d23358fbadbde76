package com.mtg.advisor.card;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Primary card types. Declaration order is the match priority when a type line
 * carries several types ("Artifact Creature" is a creature).
 */
public enum CardType {
    CREATURE("creature"),
    PLANESWALKER("planeswalker"),
    INSTANT("instant"),
    SORCERY("sorcery"),
    BATTLE("battle"),
    ENCHANTMENT("enchantment"),
    ARTIFACT("artifact"),
    LAND("land"),
    UNKNOWN("unknown");

    private final String jsonValue;

    CardType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public boolean isSpell() {
        return this == INSTANT || this == SORCERY;
    }

    /**
     * Extract the primary type from a type line such as "Legendary Creature — Elf Druid".
     * Only the text before the em-dash is considered.
     */
    public static CardType fromTypeLine(String typeLine) {
        if (typeLine == null || typeLine.isBlank()) {
            return UNKNOWN;
        }
        String line = typeLine;
        int faces = line.indexOf("//");
        if (faces >= 0) {
            line = line.substring(0, faces);
        }
        int dash = line.indexOf('—');
        String supertypes = (dash >= 0 ? line.substring(0, dash) : line).toLowerCase(Locale.ROOT);
        for (CardType type : values()) {
            if (type != UNKNOWN && supertypes.contains(type.jsonValue)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    public static CardType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Card type cannot be null");
        }
        for (CardType type : values()) {
            if (type.jsonValue.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown card type: " + value);
    }
}
