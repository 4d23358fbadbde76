package com.mtg.advisor.recommend;

import java.util.List;

/**
 * One strategy for finding candidate cards. Implementations never throw for data or
 * service problems; a phase that finds nothing returns an empty list.
 */
public interface CandidateSourcer {

    /**
     * The phase this sourcer runs in.
     */
    RecommendationPhase phase();

    /**
     * Up to {@code request.target()} scored candidates, none of them already in the deck.
     */
    List<SmartRecommendation> source(SourcingRequest request);
}
