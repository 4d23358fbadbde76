package com.mtg.advisor.analysis;

/**
 * Structural health sub-scores, each in [0, 100].
 */
public record DeckHealth(int curve, int colorConsistency, int cardBalance, int manaEfficiency, int overall) {

    private static final DeckHealth ZERO = new DeckHealth(0, 0, 0, 0, 0);

    public DeckHealth {
        requireScore("curve", curve);
        requireScore("colorConsistency", colorConsistency);
        requireScore("cardBalance", cardBalance);
        requireScore("manaEfficiency", manaEfficiency);
        requireScore("overall", overall);
    }

    public static DeckHealth zero() {
        return ZERO;
    }

    /**
     * Combine sub-scores; overall is their unweighted, rounded mean.
     */
    public static DeckHealth of(int curve, int colorConsistency, int cardBalance, int manaEfficiency) {
        int overall = (int) Math.round((curve + colorConsistency + cardBalance + manaEfficiency) / 4.0);
        return new DeckHealth(curve, colorConsistency, cardBalance, manaEfficiency, overall);
    }

    private static void requireScore(String name, int value) {
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException(name + " must be in [0, 100]: " + value);
        }
    }
}
