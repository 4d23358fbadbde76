package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.analysis.DeckAnalyzer;
import com.mtg.advisor.deck.Collection;
import com.mtg.advisor.deck.Deck;
import com.mtg.advisor.source.CachingCardSource;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for deck analysis and card recommendations.
 */
public class RecommendationEngine {

    private final Map<RecommendationPhase, CandidateSourcer> sourcers = new EnumMap<>(RecommendationPhase.class);

    /**
     * Engine with the standard four sourcers reading through {@code source}.
     */
    public RecommendationEngine(CachingCardSource source, int pageLimit) {
        this(source, new ScoringEngine(), pageLimit);
    }

    public RecommendationEngine(CachingCardSource source, ScoringEngine scoring, int pageLimit) {
        this(List.of(
            new FormatStapleSourcer(source, scoring, pageLimit),
            new ArchetypeSourcer(source, scoring, pageLimit),
            new ThemeSynergySourcer(source, scoring, pageLimit),
            new CurveGapSourcer(source, scoring, pageLimit)));
    }

    /**
     * Engine with custom sourcers; at most one per sourcing phase.
     */
    public RecommendationEngine(List<CandidateSourcer> sourcers) {
        for (CandidateSourcer sourcer : sourcers) {
            if (!sourcer.phase().isSourcing()) {
                throw new IllegalArgumentException("Not a sourcing phase: " + sourcer.phase());
            }
            if (this.sourcers.putIfAbsent(sourcer.phase(), sourcer) != null) {
                throw new IllegalArgumentException("Duplicate sourcer for phase " + sourcer.phase());
            }
        }
    }

    /**
     * Analyze the deck's mainboard. No I/O.
     */
    public DeckAnalysis analyze(Deck deck) {
        return DeckAnalyzer.analyze(deck);
    }

    /**
     * Ranked recommendations for the deck.
     *
     * @param collection owned cards, may be null
     * @param count      maximum number of recommendations; zero or less yields an empty list
     * @param format     format name; null uses the deck's format
     */
    public List<SmartRecommendation> recommend(Deck deck, Collection collection, int count, String format) {
        return recommendWithProgress(deck, collection, count, format, ProgressListener.NONE);
    }

    /**
     * Same as {@link #recommend}, reporting each phase to {@code listener} as it completes.
     */
    public List<SmartRecommendation> recommendWithProgress(Deck deck, Collection collection, int count, String format,
                                                           ProgressListener listener) {
        return start(deck, collection, count, format, listener).runToCompletion();
    }

    /**
     * A run positioned at INIT, for callers that drive the phases themselves.
     * A count of zero or less runs every phase without sourcing anything.
     */
    public RecommendationRun start(Deck deck, Collection collection, int count, String format,
                                   ProgressListener listener) {
        DeckAnalysis analysis = analyze(deck);
        Set<String> deckNames = deck == null ? Set.of() : deck.getMainboardNames();
        String effectiveFormat = format != null ? format : deck != null ? deck.getFormat() : null;
        return new RecommendationRun(analysis, deckNames, collection, Math.max(0, count), effectiveFormat,
            sourcers, listener);
    }
}
