package com.mtg.advisor.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Strategic classification of a deck, with the oracle-text signals and CMC sweet
 * spot that cards fitting the archetype tend to show.
 */
public enum Archetype {
    AGGRO("aggro", 1, 3,
        List.of("haste", "prowess", "first strike", "menace", "trample"),
        List.of("haste", "prowess", "damage", "attack", "creature")),
    CONTROL("control", 2, 6,
        List.of("counter", "draw", "exile", "destroy", "flash"),
        List.of("counter", "draw", "destroy", "exile", "instant", "sorcery")),
    MIDRANGE("midrange", 2, 5,
        List.of("enters", "whenever", "tap", "untap", "value"),
        List.of("enters", "whenever", "creature", "versatile")),
    COMBO("combo", 1, 4,
        List.of("search", "tutor", "sacrifice", "graveyard", "storm"),
        List.of("search", "tutor", "sacrifice", "graveyard")),
    RAMP("ramp", 2, 7,
        List.of("add {", "land", "search your library", "mana"),
        List.of("mana", "land", "add {", "creature")),
    /** Empty deck: nothing to classify. Scores like midrange. */
    UNKNOWN("unknown", 2, 5,
        List.of("enters", "whenever", "tap", "untap", "value"),
        List.of("enters", "whenever", "creature", "versatile"));

    private final String label;
    private final int sweetSpotMin;
    private final int sweetSpotMax;
    private final List<String> synergyTerms;
    private final List<String> metaTerms;

    Archetype(String label, int sweetSpotMin, int sweetSpotMax, List<String> synergyTerms, List<String> metaTerms) {
        this.label = label;
        this.sweetSpotMin = sweetSpotMin;
        this.sweetSpotMax = sweetSpotMax;
        this.synergyTerms = synergyTerms;
        this.metaTerms = metaTerms;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getSweetSpotMin() {
        return sweetSpotMin;
    }

    public int getSweetSpotMax() {
        return sweetSpotMax;
    }

    /**
     * Oracle-text terms that signal a card plays into this archetype.
     */
    public List<String> getSynergyTerms() {
        return synergyTerms;
    }

    /**
     * Oracle/type terms that make a card relevant in this archetype's metagame.
     */
    public List<String> getMetaTerms() {
        return metaTerms;
    }

    @Override
    public String toString() {
        return label;
    }
}
