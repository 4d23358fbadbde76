package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.card.CardNames;
import com.mtg.advisor.deck.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One recommendation request as an explicit state machine:
 * INIT → STAPLES → ARCHETYPE → SYNERGY → CURVE → FINALIZE → DONE.
 * <p>
 * Each {@link #advance()} runs exactly one phase and reports it. A caller may stop
 * advancing at any point; nothing runs in the background.
 */
public class RecommendationRun {
    private static final Logger log = LoggerFactory.getLogger(RecommendationRun.class);

    private final DeckAnalysis analysis;
    private final Set<String> deckNames;
    private final Collection collection;
    private final int count;
    private final String format;
    private final Map<RecommendationPhase, CandidateSourcer> sourcers;
    private final ProgressListener listener;
    private final int total;

    private final List<SmartRecommendation> gathered = new ArrayList<>();
    private List<SmartRecommendation> results = List.of();
    private RecommendationPhase phase = RecommendationPhase.INIT;

    RecommendationRun(DeckAnalysis analysis, Set<String> deckNames, Collection collection, int count, String format,
                      Map<RecommendationPhase, CandidateSourcer> sourcers, ProgressListener listener) {
        this.analysis = analysis;
        this.deckNames = Set.copyOf(deckNames);
        this.collection = collection == null ? Collection.empty() : collection;
        this.count = count;
        this.format = format;
        this.sourcers = sourcers;
        this.listener = listener == null ? ProgressListener.NONE : listener;
        this.total = RecommendationPhase.totalTarget(count);
    }

    public RecommendationPhase phase() {
        return phase;
    }

    public boolean isDone() {
        return phase == RecommendationPhase.DONE;
    }

    /**
     * Run the next phase and report it.
     *
     * @return the phase now completed
     * @throws IllegalStateException if the run is already done
     */
    public RecommendationPhase advance() {
        if (isDone()) {
            throw new IllegalStateException("Recommendation run already finished");
        }
        RecommendationPhase next = phase.next();
        switch (next) {
            case STAPLES, ARCHETYPE, SYNERGY, CURVE -> {
                runSourcer(next);
                listener.onProgress(next, gathered.size(), total, List.copyOf(gathered));
            }
            case FINALIZE -> {
                results = RecommendationRanker.rank(CollectionAnnotator.annotate(gathered, collection), count);
                log.info("Ranked {} candidates into {} recommendations", gathered.size(), results.size());
                listener.onProgress(next, gathered.size(), total, results);
            }
            default -> {
                // DONE: nothing left to do
            }
        }
        phase = next;
        return phase;
    }

    /**
     * Advance until done and return the final list.
     */
    public List<SmartRecommendation> runToCompletion() {
        while (!isDone()) {
            advance();
        }
        return results;
    }

    /**
     * Candidates gathered so far, unranked and possibly duplicated.
     */
    public List<SmartRecommendation> gathered() {
        return List.copyOf(gathered);
    }

    /**
     * The final list; empty until FINALIZE has run.
     */
    public List<SmartRecommendation> results() {
        return results;
    }

    public int total() {
        return total;
    }

    private void runSourcer(RecommendationPhase sourcingPhase) {
        CandidateSourcer sourcer = sourcers.get(sourcingPhase);
        if (sourcer == null) {
            log.debug("No sourcer registered for {}", sourcingPhase);
            return;
        }
        SourcingRequest request = new SourcingRequest(analysis, deckNames, sourcingPhase.targetFor(count), format);
        for (SmartRecommendation candidate : sourcer.source(request)) {
            if (!request.isExcluded(CardNames.normalize(candidate.name()))) {
                gathered.add(candidate);
            }
        }
    }
}
