package com.mtg.advisor.analysis;

import com.fasterxml.jackson.annotation.JsonValue;
import com.mtg.advisor.card.Card;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tribal and mechanical themes, each with the search fragment used to find more cards for it.
 * Tribal themes are read from a card's name and type line, mechanical ones from its rules text.
 */
public enum Theme {
    // Tribal
    ELF("elf", true, "t:elf", "elf", "elves", "elvish"),
    GOBLIN("goblin", true, "t:goblin", "goblin"),
    VAMPIRE("vampire", true, "t:vampire", "vampire"),
    ZOMBIE("zombie", true, "t:zombie", "zombie"),
    HUMAN("human", true, "t:human", "human"),
    MERFOLK("merfolk", true, "t:merfolk", "merfolk"),
    ANGEL("angel", true, "t:angel", "angel"),
    DRAGON("dragon", true, "t:dragon", "dragon"),
    WIZARD("wizard", true, "t:wizard", "wizard"),
    KNIGHT("knight", true, "t:knight", "knight"),

    // Mechanics
    BURN("burn", false, "o:\"damage to any target\"", "damage", "burn"),
    COUNTERSPELLS("counterspells", false, "o:\"counter target\"", "counter target"),
    CARD_DRAW("card draw", false, "o:\"draw a card\"", "draw"),
    RAMP("ramp", false, "(o:\"search your library for a basic land\" OR o:\"add one mana\")",
        "ramp", "add {", "search your library for a basic land"),
    GRAVEYARD("graveyard", false, "o:graveyard", "graveyard", "flashback", "dredge", "delve", "escape"),
    SACRIFICE("sacrifice", false, "o:sacrifice", "sacrifice", "dies"),
    ARTIFACTS("artifacts", false, "o:artifact", "artifact", "metalcraft", "affinity", "improvise"),
    LIFEGAIN("lifegain", false, "o:\"you gain\"", "gain life", "gains life", "you gain", "lifelink"),
    TOKENS("tokens", false, "o:create o:token", "token"),
    SPELLS_MATTER("spells matter", false, "o:\"instant or sorcery\"",
        "prowess", "instant or sorcery", "noncreature spell", "magecraft");

    private final String label;
    private final boolean tribal;
    private final String searchFragment;
    private final List<String> patterns;

    Theme(String label, boolean tribal, String searchFragment, String... patterns) {
        this.label = label;
        this.tribal = tribal;
        this.searchFragment = searchFragment;
        this.patterns = List.of(patterns);
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isTribal() {
        return tribal;
    }

    /**
     * Search-query fragment that finds cards for this theme.
     */
    public String getSearchFragment() {
        return searchFragment;
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
     * Whether the card itself plays into this theme.
     */
    public boolean matches(Card card) {
        return matches(searchableText(card, tribal));
    }

    /**
     * Every theme the card touches, in declaration order.
     */
    public static List<Theme> detect(Card card) {
        String tribalText = searchableText(card, true);
        String rulesText = searchableText(card, false);
        List<Theme> themes = new ArrayList<>();
        for (Theme theme : values()) {
            if (theme.matches(theme.tribal ? tribalText : rulesText)) {
                themes.add(theme);
            }
        }
        return themes;
    }

    private static String searchableText(Card card, boolean tribal) {
        String text = tribal ? card.getName() + " " + card.getTypeLine() : card.getOracleText();
        return text.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return label;
    }
}
