package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.card.ColorFlags;

import java.util.Locale;
import java.util.Set;

/**
 * What a sourcer needs to know about one phase of a run.
 *
 * @param analysis      the deck's analysis
 * @param excludedNames normalized names already in the mainboard
 * @param target        how many candidates the phase should gather
 * @param format        format name, lower case
 */
public record SourcingRequest(DeckAnalysis analysis, Set<String> excludedNames, int target, String format) {

    public SourcingRequest {
        excludedNames = Set.copyOf(excludedNames);
        format = format == null || format.isBlank() ? "standard" : format.trim().toLowerCase(Locale.ROOT);
        if (target < 0) {
            throw new IllegalArgumentException("target must not be negative: " + target);
        }
    }

    public FormatPolicy policy() {
        return FormatPolicy.forFormat(format);
    }

    public ColorFlags deckColors() {
        return analysis.colorFlags();
    }

    public boolean isExcluded(String normalizedName) {
        return excludedNames.contains(normalizedName);
    }
}
