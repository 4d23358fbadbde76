package com.mtg.advisor.recommend;

/**
 * Stages of a recommendation run, in execution order.
 * Transitions are linear: each phase has exactly one successor.
 */
public enum RecommendationPhase {
    INIT("Initializing"),
    STAPLES("Finding format staples"),
    ARCHETYPE("Matching archetype"),
    SYNERGY("Finding theme synergies"),
    CURVE("Filling mana curve gaps"),
    FINALIZE("Ranking recommendations"),
    DONE("Done");

    private final String label;

    RecommendationPhase(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSourcing() {
        return this == STAPLES || this == ARCHETYPE || this == SYNERGY || this == CURVE;
    }

    public RecommendationPhase next() {
        return switch (this) {
            case INIT -> STAPLES;
            case STAPLES -> ARCHETYPE;
            case ARCHETYPE -> SYNERGY;
            case SYNERGY -> CURVE;
            case CURVE -> FINALIZE;
            case FINALIZE, DONE -> DONE;
        };
    }

    /**
     * Candidates this phase aims to gather for a request of {@code count} cards.
     */
    public int targetFor(int count) {
        return switch (this) {
            case STAPLES -> count;
            case ARCHETYPE, SYNERGY -> (int) Math.ceil(count * 0.8);
            case CURVE -> (int) Math.ceil(count * 0.6);
            default -> 0;
        };
    }

    /**
     * Sum of every sourcing phase's target.
     */
    public static int totalTarget(int count) {
        int total = 0;
        for (RecommendationPhase phase : values()) {
            total += phase.targetFor(count);
        }
        return total;
    }

    @Override
    public String toString() {
        return label;
    }
}
