package com.mtg.advisor.analysis;

import java.util.Map;

/**
 * A mana value the deck plays less often than the ideal curve calls for.
 *
 * @param cmc         the under-represented mana value
 * @param actualShare share of non-land cards at this mana value
 * @param idealShare  share the ideal curve asks for
 */
public record CurveGap(int cmc, double actualShare, double idealShare) {

    /** Ideal share of non-land cards at each mana value considered for gap filling. */
    public static final Map<Integer, Double> IDEAL_SHARES = Map.of(
        1, 0.20,
        2, 0.30,
        3, 0.25,
        4, 0.15,
        5, 0.10
    );

    /** A mana value is a gap when its share falls below this fraction of the ideal. */
    public static final double GAP_THRESHOLD = 0.6;

    /**
     * How far below the ideal share the deck sits.
     */
    public double gapSize() {
        return idealShare - actualShare;
    }
}
