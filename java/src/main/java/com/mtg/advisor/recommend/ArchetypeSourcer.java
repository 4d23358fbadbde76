package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.Archetype;
import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.source.CachingCardSource;
import com.mtg.advisor.source.SearchOptions;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cards that play into the deck's archetype. Each archetype has a few fixed queries
 * and the target is spread evenly over them.
 */
public class ArchetypeSourcer extends AbstractCandidateSourcer {

    /** Candidates with a weaker archetype fit are dropped. */
    public static final double MIN_ARCHETYPE_SYNERGY = 0.4;

    static final Map<Archetype, List<String>> QUERIES = new EnumMap<>(Map.of(
        Archetype.AGGRO, List.of(
            "t:creature cmc<=3 (o:haste OR o:\"first strike\" OR o:trample)",
            "t:creature cmc<=2 pow>=2",
            "(t:instant OR t:sorcery) o:damage cmc<=2"),
        Archetype.CONTROL, List.of(
            "o:\"counter target\"",
            "(o:\"destroy all\" OR o:\"exile all\")",
            "(t:instant OR t:sorcery) o:draw"),
        Archetype.MIDRANGE, List.of(
            "t:creature cmc>=3 cmc<=5 o:enters",
            "(o:\"destroy target\" OR o:\"exile target\") cmc<=4",
            "t:planeswalker cmc<=5"),
        Archetype.COMBO, List.of(
            "o:\"search your library for a card\"",
            "o:sacrifice o:whenever",
            "o:\"from your graveyard\" o:return"),
        Archetype.RAMP, List.of(
            "o:\"search your library for a basic land\"",
            "o:\"add one mana of any color\"",
            "t:creature cmc>=6")
    ));

    public ArchetypeSourcer(CachingCardSource source, ScoringEngine scoring, int pageLimit) {
        super(source, scoring, pageLimit);
    }

    @Override
    public RecommendationPhase phase() {
        return RecommendationPhase.ARCHETYPE;
    }

    static List<String> queriesFor(Archetype archetype) {
        return QUERIES.getOrDefault(archetype, QUERIES.get(Archetype.MIDRANGE));
    }

    @Override
    protected List<SmartRecommendation> collect(SourcingRequest request) {
        DeckAnalysis analysis = request.analysis();
        Archetype archetype = analysis.archetype();
        FormatPolicy policy = request.policy();
        List<String> queries = queriesFor(archetype);
        int perQuery = share(request.target(), queries.size());
        String base = baseQuery(request);

        Set<String> seen = new HashSet<>();
        List<SmartRecommendation> recommendations = new ArrayList<>();

        for (String fragment : queries) {
            if (recommendations.size() >= request.target()) {
                break;
            }
            int taken = 0;
            for (Card card : fetch(base + " " + fragment, request, SearchOptions.Order.EDHREC, perQuery)) {
                if (taken >= perQuery || recommendations.size() >= request.target()) {
                    break;
                }
                if (!accept(card, request, seen)) {
                    continue;
                }
                double archetypeScore = scoring.archetypeSynergy(card, archetype);
                if (archetypeScore < MIN_ARCHETYPE_SYNERGY) {
                    continue;
                }
                double colorScore = scoring.colorSynergy(card, request.deckColors(), policy);
                double synergy = (archetypeScore + colorScore) / 2.0;

                ScoringEngine.Scores scores = scoring.score(card, analysis, policy, synergy, 0.0);
                List<String> reasons = List.of(
                    "Perfect fit for " + archetype.getLabel() + " strategy",
                    "Strong " + archetype.getLabel() + " synergy");
                recommendations.add(scoring.toRecommendation(card, scores, policy, reasons));
                taken++;
            }
        }
        return recommendations;
    }
}
