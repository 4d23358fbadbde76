package com.mtg.advisor.recommend;

import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.ColorFlags;
import com.mtg.advisor.source.CachingCardSource;
import com.mtg.advisor.source.SearchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Shared plumbing for sourcers: base query, over-fetching through the cache, and
 * candidate filtering (already in deck, seen in this phase, off-color, basic land).
 */
public abstract class AbstractCandidateSourcer implements CandidateSourcer {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final CachingCardSource source;
    protected final ScoringEngine scoring;
    protected final int pageLimit;

    protected AbstractCandidateSourcer(CachingCardSource source, ScoringEngine scoring, int pageLimit) {
        if (pageLimit < 1) {
            throw new IllegalArgumentException("pageLimit must be positive: " + pageLimit);
        }
        this.source = source;
        this.scoring = scoring;
        this.pageLimit = pageLimit;
    }

    @Override
    public final List<SmartRecommendation> source(SourcingRequest request) {
        if (request.target() == 0 || request.analysis().isEmpty()) {
            return List.of();
        }
        List<SmartRecommendation> candidates = collect(request);
        log.info("{}: {} candidates (target {})", phase().getLabel(), candidates.size(), request.target());
        return candidates;
    }

    /**
     * Gather candidates for a non-empty deck and a positive target.
     */
    protected abstract List<SmartRecommendation> collect(SourcingRequest request);

    /**
     * Format legality, the deck's color identity (when it has colors) and no basic lands.
     */
    protected static String baseQuery(SourcingRequest request) {
        StringBuilder query = new StringBuilder("legal:").append(request.format());
        ColorFlags colors = request.deckColors();
        if (!colors.isEmpty()) {
            query.append(" ci<=").append(colors.toSymbols().toLowerCase(Locale.ROOT));
        }
        query.append(" -t:basic");
        return query.toString();
    }

    /**
     * Fetch twice as many cards as wanted, within the service's page size, to leave room for filtering.
     */
    protected List<Card> fetch(String query, SourcingRequest request, SearchOptions.Order order, int wanted) {
        int limit = Math.max(1, Math.min(wanted * 2, pageLimit));
        return source.search(query, SearchOptions.forFormat(request.format(), order, limit));
    }

    /**
     * Whether a fetched card may become a candidate. Records the card in {@code seen}.
     */
    protected boolean accept(Card card, SourcingRequest request, Set<String> seen) {
        String name = card.getNormalizedName();
        if (request.isExcluded(name) || card.isBasicLand()) {
            return false;
        }
        if (!request.policy().isColorCompatible(card, request.deckColors())) {
            log.debug("Dropping off-color candidate {}", card.getName());
            return false;
        }
        return seen.add(name);
    }

    /**
     * Even share of {@code target} across {@code parts}, rounded up.
     */
    protected static int share(int target, int parts) {
        return parts <= 0 ? 0 : (target + parts - 1) / parts;
    }
}
