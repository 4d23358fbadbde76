package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.CurveGap;
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
 * Cards at under-represented mana values, biggest gap first. A deck without gaps gets nothing.
 */
public class CurveGapSourcer extends AbstractCandidateSourcer {

    /** Confidence bonus per unit of gap size. */
    public static final double GAP_CONFIDENCE_BOOST = 0.3;

    public CurveGapSourcer(CachingCardSource source, ScoringEngine scoring, int pageLimit) {
        super(source, scoring, pageLimit);
    }

    @Override
    public RecommendationPhase phase() {
        return RecommendationPhase.CURVE;
    }

    @Override
    protected List<SmartRecommendation> collect(SourcingRequest request) {
        DeckAnalysis analysis = request.analysis();
        List<CurveGap> gaps = analysis.curveGaps();
        if (gaps.isEmpty()) {
            log.debug("Curve has no gaps");
            return List.of();
        }

        FormatPolicy policy = request.policy();
        int perGap = share(request.target(), gaps.size());
        String base = baseQuery(request);

        Set<String> seen = new HashSet<>();
        List<SmartRecommendation> recommendations = new ArrayList<>();

        for (CurveGap gap : gaps) {
            if (recommendations.size() >= request.target()) {
                break;
            }
            int cmc = gap.cmc();
            String query = base + " cmc=" + cmc + " (r:c OR r:u OR r:r)";
            int taken = 0;
            for (Card card : fetch(query, request, SearchOptions.Order.EDHREC, perGap)) {
                if (taken >= perGap || recommendations.size() >= request.target()) {
                    break;
                }
                if (card.getCmc() != cmc || !accept(card, request, seen)) {
                    continue;
                }
                double synergy = scoring.curveSynergy(card, analysis);
                ScoringEngine.Scores scores = scoring.score(card, analysis, policy, synergy,
                    gap.gapSize() * GAP_CONFIDENCE_BOOST);

                List<String> reasons = new ArrayList<>();
                reasons.add("Fills mana curve gap at " + cmc + " CMC");
                reasons.add(String.format(Locale.ROOT, "%.0f%% below the ideal share of %d-drops",
                    gap.gapSize() * 100, cmc));
                if (cmc <= 3) {
                    reasons.add("Strong early-to-mid game presence");
                }
                recommendations.add(scoring.toRecommendation(card, scores, policy, reasons));
                taken++;
            }
        }
        return recommendations;
    }
}
