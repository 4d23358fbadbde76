package com.mtg.advisor.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse game plan read from curve shape, spell density and color count.
 */
public enum Strategy {
    AGGRO("aggro"),
    CONTROL("control"),
    MIDRANGE("midrange"),
    RAMP("ramp"),
    MULTICOLOR("multicolor"),
    UNKNOWN("unknown");

    private final String label;

    Strategy(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
