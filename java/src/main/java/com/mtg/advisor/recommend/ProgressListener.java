package com.mtg.advisor.recommend;

import java.util.List;

/**
 * Receives a snapshot after each phase of a recommendation run.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (phase, count, total, partial) -> { };

    /**
     * @param phase   the phase that just completed
     * @param count   candidates gathered so far
     * @param total   sum of all phase targets
     * @param partial candidates so far, or the final list after {@link RecommendationPhase#FINALIZE}
     */
    void onProgress(RecommendationPhase phase, int count, int total, List<SmartRecommendation> partial);
}
