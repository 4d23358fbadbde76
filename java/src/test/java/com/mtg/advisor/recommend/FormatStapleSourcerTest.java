package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.analysis.DeckAnalyzer;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.Rarity;
import com.mtg.advisor.deck.Deck;
import com.mtg.advisor.deck.DeckFixtures;
import com.mtg.advisor.source.CachingCardSource;
import com.mtg.advisor.source.CardSourceException;
import com.mtg.advisor.source.FakeCardSource;
import com.mtg.advisor.source.RequestThrottle;
import com.mtg.advisor.source.SearchOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormatStapleSourcerTest {

    private final FakeCardSource fake = new FakeCardSource();
    private final ScoringEngine scoring = new ScoringEngine(false);

    private FormatStapleSourcer sourcer(FakeCardSource cards) {
        return new FormatStapleSourcer(
                new CachingCardSource(cards, Duration.ofMinutes(5), 1000, new RequestThrottle(Duration.ZERO)),
                scoring, 175);
    }

    private static SourcingRequest request(Deck deck, int target) {
        DeckAnalysis analysis = DeckAnalyzer.analyze(deck);
        return new SourcingRequest(analysis, deck.getMainboardNames(), target, deck.getFormat());
    }

    @Test
    void testStaplesForMonoRed() {
        List<SmartRecommendation> staples = sourcer(fake).source(request(DeckFixtures.monoRed(), 20));
        assertEquals(20, staples.size());
        assertEquals(List.of("legal:modern ci<=r -t:basic cmc<=4 (r:u OR r:r)"), fake.queries());
        for (SmartRecommendation staple : staples) {
            assertTrue(staple.cmc() <= 4);
            assertTrue(staple.metaScore() >= 85.0);
            assertTrue(staple.confidence() >= FormatStapleSourcer.MIN_CONFIDENCE * 100);
            assertEquals("Popular format staple", staple.reasons().get(0));
            assertEquals("Format staple in Modern", staple.reasons().get(1));
        }
    }

    @Test
    void testDeckCardsAndOffColorCardsSkipped() {
        Card counterspell = DeckFixtures.spell("Counterspell", "{U}{U}", "Instant", "Counter target spell.",
                Rarity.UNCOMMON);
        fake.withExtra(DeckFixtures.LIGHTNING_BOLT).withExtra(counterspell);
        List<String> names = sourcer(fake).source(request(DeckFixtures.monoRed(), 20)).stream()
                .map(SmartRecommendation::name)
                .toList();
        assertFalse(names.contains("Lightning Bolt"));
        assertFalse(names.contains("Counterspell"));
        assertEquals(names.size(), names.stream().distinct().count());
    }

    @Test
    void testFallbackQuery() {
        FakeCardSource picky = new FakeCardSource() {
            @Override
            public List<Card> search(String query, SearchOptions options) throws CardSourceException {
                List<Card> cards = super.search(query, options);
                return query.contains(FormatStapleSourcer.PRIMARY_FILTER) ? List.of() : cards;
            }
        };
        List<SmartRecommendation> staples = sourcer(picky).source(request(DeckFixtures.monoRed(), 5));
        assertEquals(5, staples.size());
        assertEquals(2, picky.queries().size());
        assertTrue(picky.queries().get(1).endsWith(FormatStapleSourcer.FALLBACK_FILTER));
    }

    @Test
    void testEmptyDeckOrZeroTarget() {
        assertTrue(sourcer(fake).source(request(DeckFixtures.empty(), 20)).isEmpty());
        assertTrue(sourcer(fake).source(request(DeckFixtures.monoRed(), 0)).isEmpty());
        assertEquals(0, fake.callCount());
    }

    @Test
    void testServiceFailureYieldsNothing() {
        fake.setFailing(true);
        assertTrue(sourcer(fake).source(request(DeckFixtures.monoRed(), 20)).isEmpty());
    }

    @Test
    void testPhase() {
        assertEquals(RecommendationPhase.STAPLES, sourcer(fake).phase());
    }
}
