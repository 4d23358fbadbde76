package com.mtg.advisor.recommend;

import com.fasterxml.jackson.annotation.JsonValue;
import com.mtg.advisor.card.Rarity;

/**
 * What it takes to get a recommended card: already owned, or a craft tier by rarity.
 */
public enum CostConsideration {
    OWNED("owned"),
    COMMON_CRAFT("common_craft"),
    UNCOMMON_CRAFT("uncommon_craft"),
    RARE_CRAFT("rare_craft"),
    MYTHIC_CRAFT("mythic_craft");

    private final String jsonValue;

    CostConsideration(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public static CostConsideration fromRarity(Rarity rarity) {
        if (rarity == null) {
            return COMMON_CRAFT;
        }
        return switch (rarity) {
            case COMMON -> COMMON_CRAFT;
            case UNCOMMON -> UNCOMMON_CRAFT;
            case RARE -> RARE_CRAFT;
            case MYTHIC -> MYTHIC_CRAFT;
        };
    }

    @Override
    public String toString() {
        return jsonValue;
    }
}
