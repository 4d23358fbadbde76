package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.analysis.DeckAnalyzer;
import com.mtg.advisor.deck.Deck;
import com.mtg.advisor.deck.DeckCard;
import com.mtg.advisor.deck.DeckFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AbstractCandidateSourcerTest {

    @Test
    void testBaseQueryWithColors() {
        DeckAnalysis analysis = DeckAnalyzer.analyze(DeckFixtures.monoRed());
        SourcingRequest request = new SourcingRequest(analysis, Set.of(), 5, "Pioneer");
        assertEquals("legal:pioneer ci<=r -t:basic", AbstractCandidateSourcer.baseQuery(request));
    }

    @Test
    void testBaseQueryColorless() {
        Deck lands = new Deck("Lands", "legacy", List.of(DeckCard.mainboard(DeckFixtures.MOUNTAIN, 10)));
        SourcingRequest request = new SourcingRequest(DeckAnalyzer.analyze(lands), Set.of(), 5, null);
        assertEquals("legal:standard -t:basic", AbstractCandidateSourcer.baseQuery(request));
    }

    @Test
    void testShare() {
        assertEquals(6, AbstractCandidateSourcer.share(16, 3));
        assertEquals(4, AbstractCandidateSourcer.share(16, 4));
        assertEquals(0, AbstractCandidateSourcer.share(16, 0));
    }

    @Test
    void testRequestPolicy() {
        DeckAnalysis analysis = DeckAnalysis.empty();
        assertEquals(FormatPolicy.SINGLETON, new SourcingRequest(analysis, Set.of(), 1, "Commander").policy());
        assertEquals(FormatPolicy.CONSTRUCTED, new SourcingRequest(analysis, Set.of(), 1, "modern").policy());
        assertThrows(IllegalArgumentException.class, () -> new SourcingRequest(analysis, Set.of(), -1, "modern"));
    }
}
