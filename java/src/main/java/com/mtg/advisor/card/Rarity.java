package com.mtg.advisor.card;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Card rarities as reported by Scryfall.
 */
public enum Rarity {
    COMMON("common"),
    UNCOMMON("uncommon"),
    RARE("rare"),
    MYTHIC("mythic");

    private final String jsonValue;

    Rarity(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Lenient parse: "Mythic Rare" and "mythic" are both mythic, Scryfall's
     * "special" and "bonus" rarities count as rare, anything else is common.
     */
    public static Rarity fromString(String value) {
        if (value == null || value.isBlank()) {
            return COMMON;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("mythic")) {
            return MYTHIC;
        }
        return switch (v) {
            case "uncommon" -> UNCOMMON;
            case "rare", "special", "bonus" -> RARE;
            default -> COMMON;
        };
    }
}
