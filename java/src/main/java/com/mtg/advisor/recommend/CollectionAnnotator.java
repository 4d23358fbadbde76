package com.mtg.advisor.recommend;

import com.mtg.advisor.deck.Collection;

import java.util.ArrayList;
import java.util.List;

/**
 * Marks recommendations the user already owns.
 */
public final class CollectionAnnotator {

    private CollectionAnnotator() {
        // Utility class - prevent instantiation
    }

    /**
     * Owned cards become {@link CostConsideration#OWNED} with the ownership reason first;
     * the rest keep the craft tier of their rarity. A null collection owns nothing.
     */
    public static List<SmartRecommendation> annotate(List<SmartRecommendation> recommendations, Collection collection) {
        Collection owned = collection == null ? Collection.empty() : collection;
        List<SmartRecommendation> annotated = new ArrayList<>(recommendations.size());
        for (SmartRecommendation recommendation : recommendations) {
            int quantity = owned.quantityOf(recommendation.name());
            annotated.add(quantity > 0 ? recommendation.withOwnership(quantity) : recommendation.withCraftCost());
        }
        return annotated;
    }
}
