package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.analysis.Theme;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.source.CachingCardSource;
import com.mtg.advisor.source.SearchOptions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cards that share the deck's most salient themes (up to four), target spread evenly.
 */
public class ThemeSynergySourcer extends AbstractCandidateSourcer {

    public static final int MAX_THEMES = 4;

    /** Weight of a theme query's synergy relative to a direct color match. */
    public static final double THEME_WEIGHT = 0.8;

    public ThemeSynergySourcer(CachingCardSource source, ScoringEngine scoring, int pageLimit) {
        super(source, scoring, pageLimit);
    }

    @Override
    public RecommendationPhase phase() {
        return RecommendationPhase.SYNERGY;
    }

    @Override
    protected List<SmartRecommendation> collect(SourcingRequest request) {
        DeckAnalysis analysis = request.analysis();
        List<Theme> themes = analysis.themes().subList(0, Math.min(MAX_THEMES, analysis.themes().size()));
        if (themes.isEmpty()) {
            log.debug("No themes detected, nothing to source");
            return List.of();
        }

        FormatPolicy policy = request.policy();
        int perTheme = share(request.target(), themes.size());
        String base = baseQuery(request);

        Set<String> seen = new HashSet<>();
        List<SmartRecommendation> recommendations = new ArrayList<>();

        for (Theme theme : themes) {
            if (recommendations.size() >= request.target()) {
                break;
            }
            int deckCount = analysis.themeCount(theme);
            int taken = 0;
            for (Card card : fetch(base + " " + theme.getSearchFragment(), request,
                    SearchOptions.Order.EDHREC, perTheme)) {
                if (taken >= perTheme || recommendations.size() >= request.target()) {
                    break;
                }
                if (!accept(card, request, seen)) {
                    continue;
                }
                double synergy = scoring.weightedSynergy(card, scoring.themeSynergy(card, theme, deckCount), THEME_WEIGHT);
                ScoringEngine.Scores scores = scoring.score(card, analysis, policy, synergy, 0.0);
                List<String> reasons = List.of(
                    "Strong " + theme.getLabel() + " synergy",
                    "Synergizes with " + deckCount + " existing " + theme.getLabel() + " cards");
                recommendations.add(scoring.toRecommendation(card, scores, policy, reasons));
                taken++;
            }
        }
        return recommendations;
    }
}
