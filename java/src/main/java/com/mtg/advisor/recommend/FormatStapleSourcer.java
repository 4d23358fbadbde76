package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.source.CachingCardSource;
import com.mtg.advisor.source.SearchOptions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Popular cards of the format in the deck's colors, most played first.
 */
public class FormatStapleSourcer extends AbstractCandidateSourcer {

    /** Staples scoring below this confidence are not worth suggesting. */
    public static final double MIN_CONFIDENCE = 0.5;

    static final String PRIMARY_FILTER = "cmc<=4 (r:u OR r:r)";
    static final String FALLBACK_FILTER = "cmc<=5";

    public FormatStapleSourcer(CachingCardSource source, ScoringEngine scoring, int pageLimit) {
        super(source, scoring, pageLimit);
    }

    @Override
    public RecommendationPhase phase() {
        return RecommendationPhase.STAPLES;
    }

    @Override
    protected List<SmartRecommendation> collect(SourcingRequest request) {
        String base = baseQuery(request);
        List<Card> cards = fetch(base + " " + PRIMARY_FILTER, request, SearchOptions.Order.EDHREC, request.target());
        if (cards.isEmpty()) {
            log.debug("No staples for primary query, broadening");
            cards = fetch(base + " " + FALLBACK_FILTER, request, SearchOptions.Order.EDHREC, request.target());
        }

        DeckAnalysis analysis = request.analysis();
        FormatPolicy policy = request.policy();
        Set<String> seen = new HashSet<>();
        List<SmartRecommendation> recommendations = new ArrayList<>();

        for (Card card : cards) {
            if (recommendations.size() >= request.target()) {
                break;
            }
            if (!accept(card, request, seen)) {
                continue;
            }
            double confidence = scoring.stapleConfidence(card, request.format());
            if (confidence < MIN_CONFIDENCE) {
                continue;
            }
            ScoringEngine.Scores scores = new ScoringEngine.Scores(
                confidence,
                scoring.colorSynergy(card, request.deckColors(), policy),
                Math.max(scoring.metaScore(card, analysis.archetype()), ScoringEngine.STAPLE_META_WEIGHT),
                scoring.deckFit(card, analysis, policy));

            List<String> reasons = List.of(
                "Popular format staple",
                "Format staple in " + displayName(request.format()),
                roleReason(card));
            recommendations.add(scoring.toRecommendation(card, scores, policy, reasons));
        }
        return recommendations;
    }

    private static String roleReason(Card card) {
        if (card.getCmc() <= 2) {
            return "Efficient early game play";
        } else if (card.getCmc() >= 5) {
            return "Powerful late game threat";
        }
        return "Solid midrange option";
    }

    private static String displayName(String format) {
        if (format.isEmpty()) {
            return format;
        }
        return format.substring(0, 1).toUpperCase(Locale.ROOT) + format.substring(1);
    }
}
