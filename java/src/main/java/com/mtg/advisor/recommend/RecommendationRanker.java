package com.mtg.advisor.recommend;

import com.mtg.advisor.card.CardNames;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges sourced candidates into the final ordering.
 */
public final class RecommendationRanker {

    /**
     * Owned cards first, then confidence (compared in 0.1-point steps), then synergy.
     */
    public static final Comparator<SmartRecommendation> ORDER =
        Comparator.comparing((SmartRecommendation r) -> !r.isOwned())
            .thenComparing(Comparator.comparingLong(RecommendationRanker::confidenceBucket).reversed())
            .thenComparing(Comparator.comparingDouble(SmartRecommendation::synergyScore).reversed());

    private RecommendationRanker() {
        // Utility class - prevent instantiation
    }

    /**
     * One entry per case-insensitive name; the first occurrence wins.
     */
    public static List<SmartRecommendation> deduplicate(List<SmartRecommendation> candidates) {
        Map<String, SmartRecommendation> unique = new LinkedHashMap<>();
        for (SmartRecommendation candidate : candidates) {
            unique.putIfAbsent(CardNames.normalize(candidate.name()), candidate);
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Deduplicate, sort and keep the first {@code count}.
     */
    public static List<SmartRecommendation> rank(List<SmartRecommendation> candidates, int count) {
        List<SmartRecommendation> ranked = deduplicate(candidates);
        ranked.sort(ORDER);
        return List.copyOf(ranked.subList(0, Math.min(count, ranked.size())));
    }

    private static long confidenceBucket(SmartRecommendation recommendation) {
        return Math.round(recommendation.confidence() * 10.0);
    }
}
