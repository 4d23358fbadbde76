package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.Archetype;
import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.analysis.DeckAnalyzer;
import com.mtg.advisor.analysis.Theme;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.CardType;
import com.mtg.advisor.card.ColorFlags;
import com.mtg.advisor.card.Rarity;
import com.mtg.advisor.deck.DeckFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the confidence, synergy, meta and fit models.
 */
class ScoringEngineTest {

    private final ScoringEngine scoring = new ScoringEngine(false);
    private final ScoringEngine jittered = new ScoringEngine();

    private static final ColorFlags WHITE = ColorFlags.parse("W");
    private static final ColorFlags RED = ColorFlags.parse("R");

    // ==================== COLOR SYNERGY ====================

    @Test
    void testSingletonOffIdentityCollapses() {
        double score = scoring.colorSynergy(RED, WHITE, FormatPolicy.SINGLETON);
        assertTrue(score <= 0.05, "off-identity card scored " + score);
        assertEquals(0.02, score, 1e-9);
        assertEquals(0.05, scoring.colorSynergy(ColorFlags.parse("RW"), ColorFlags.parse("WU"),
                FormatPolicy.SINGLETON), 1e-9);
    }

    @Test
    void testConstructedOffColorKeepsFloor() {
        double score = scoring.colorSynergy(RED, WHITE, FormatPolicy.CONSTRUCTED);
        assertTrue(score >= 0.15);
        assertEquals(0.15, score, 1e-9);
        // Half the card's colors overlap
        assertEquals(0.3 + 0.5 * 0.25, scoring.colorSynergy(ColorFlags.parse("RW"), WHITE,
                FormatPolicy.CONSTRUCTED), 1e-9);
    }

    @Test
    void testOnColor() {
        assertEquals(0.93, scoring.colorSynergy(RED, RED, FormatPolicy.SINGLETON), 1e-9);
        assertEquals(0.80, scoring.colorSynergy(RED, RED, FormatPolicy.CONSTRUCTED), 1e-9);
        assertEquals(0.81, scoring.colorSynergy(ColorFlags.parse("RG"), ColorFlags.parse("RG"),
                FormatPolicy.CONSTRUCTED), 1e-9);
        assertEquals(0.85, scoring.colorSynergy(ColorFlags.parse("WUB"), ColorFlags.parse("WUB"),
                FormatPolicy.CONSTRUCTED), 1e-9);
        assertEquals(1.0, scoring.colorSynergy(ColorFlags.parse("WUBRG"), ColorFlags.parse("WUBRG"),
                FormatPolicy.SINGLETON), 1e-9);
    }

    @Test
    void testColorlessCases() {
        assertEquals(0.75, scoring.colorSynergy(ColorFlags.none(), RED, FormatPolicy.SINGLETON), 1e-9);
        assertEquals(0.70, scoring.colorSynergy(ColorFlags.none(), RED, FormatPolicy.CONSTRUCTED), 1e-9);
        assertEquals(0.60, scoring.colorSynergy(ColorFlags.none(), ColorFlags.none(), FormatPolicy.CONSTRUCTED), 1e-9);
        assertEquals(0.40, scoring.colorSynergy(RED, ColorFlags.none(), FormatPolicy.SINGLETON), 1e-9);
    }

    @Test
    void testSingletonUsesIdentity() {
        // Red cost, but a green activated ability in its identity
        Card hybridish = Card.builder("Hypothetical")
                .manaCost("{R}")
                .colorIdentity(ColorFlags.parse("RG"))
                .build();
        assertEquals(0.05, scoring.colorSynergy(hybridish, RED, FormatPolicy.SINGLETON), 1e-9);
        assertEquals(0.80, scoring.colorSynergy(hybridish, RED, FormatPolicy.CONSTRUCTED), 1e-9);
    }

    // ==================== CONFIDENCE ====================

    @Test
    void testConfidenceFactors() {
        List<Double> factors = scoring.confidenceFactors(DeckFixtures.GOBLIN_GUIDE, Archetype.AGGRO, 0.5);
        assertEquals(6, factors.size());
        assertEquals(0.7, factors.get(0), 1e-9);
        assertEquals(0.85, factors.get(1), 1e-9);
        assertEquals(0.9, factors.get(2), 1e-9);
        assertEquals(0.9, factors.get(3), 1e-9);
    }

    @Test
    void testConfidenceIsGeometricMean() {
        Card card = DeckFixtures.LIGHTNING_BOLT;
        double expected = ScoringEngine.geometricMean(scoring.confidenceFactors(card, Archetype.CONTROL, 0.8));
        assertEquals(expected, scoring.confidence(card, Archetype.CONTROL, 0.8), 1e-9);
    }

    @Test
    void testConfidenceClamped() {
        Card weak = Card.builder("Vanilla").manaCost("{9}").typeLine("Artifact").build();
        assertEquals(ScoringEngine.CONFIDENCE_FLOOR,
                scoring.confidence(weak, Archetype.AGGRO, 0.0, -1.0), 1e-9);
        assertEquals(ScoringEngine.CONFIDENCE_CEILING,
                scoring.confidence(DeckFixtures.GOBLIN_GUIDE, Archetype.AGGRO, 1.0, 1.0), 1e-9);
    }

    @Test
    void testJitterIsSmallAndDeterministic() {
        Card card = DeckFixtures.CHAR;
        double plain = scoring.confidence(card, Archetype.AGGRO, 0.6);
        double a = jittered.confidence(card, Archetype.AGGRO, 0.6);
        double b = new ScoringEngine().confidence(card, Archetype.AGGRO, 0.6);
        assertEquals(a, b);
        assertTrue(Math.abs(a - plain) <= ScoringEngine.CONFIDENCE_JITTER);
    }

    @Test
    void testFactorLadders() {
        assertEquals(0.9, ScoringEngine.cmcFactor(0));
        assertEquals(0.6, ScoringEngine.cmcFactor(6));
        assertEquals(0.5, ScoringEngine.cmcFactor(9));
        assertEquals(ScoringEngine.TYPE_FACTOR_PERFECT, ScoringEngine.typeFactor(CardType.SORCERY, Archetype.CONTROL));
        assertEquals(ScoringEngine.TYPE_FACTOR_GOOD, ScoringEngine.typeFactor(CardType.CREATURE, Archetype.UNKNOWN));
        assertEquals(ScoringEngine.TYPE_FACTOR_PLANESWALKER,
                ScoringEngine.typeFactor(CardType.PLANESWALKER, Archetype.AGGRO));
        assertEquals(ScoringEngine.TYPE_FACTOR_OTHER, ScoringEngine.typeFactor(CardType.LAND, Archetype.RAMP));
        assertEquals(0.65, ScoringEngine.complexityFactor(0));
        assertEquals(0.9, ScoringEngine.complexityFactor(121));
        assertEquals(0.7, ScoringEngine.keywordFactor(0));
        assertEquals(0.9, ScoringEngine.keywordFactor(5));
    }

    @Test
    void testStapleConfidence() {
        Card legal = Card.builder("Staple").manaCost("{1}{R}").typeLine("Instant")
                .oracleText("Staple deals 3 damage to any target.").rarity(Rarity.UNCOMMON)
                .legality("modern", "legal").build();
        Card banned = Card.builder("Banned Staple").manaCost("{1}{R}").typeLine("Instant")
                .oracleText("Staple deals 3 damage to any target.").rarity(Rarity.UNCOMMON)
                .legality("modern", "banned").build();
        double legalScore = scoring.stapleConfidence(legal, "modern");
        double bannedScore = scoring.stapleConfidence(banned, "modern");
        assertTrue(legalScore > bannedScore);
        assertTrue(legalScore >= ScoringEngine.STAPLE_FLOOR && legalScore <= ScoringEngine.STAPLE_CEILING);
        double expected = ScoringEngine.geometricMean(List.of(0.9, 0.78, 0.9, 0.8, 0.85));
        assertEquals(expected, legalScore, 1e-9);
    }

    // ==================== ARCHETYPE, CURVE, THEME ====================

    @Test
    void testArchetypeSynergy() {
        // base 0.4 + haste 0.08 + sweet spot edge 0.1 + creature 0.15
        assertEquals(0.73, scoring.archetypeSynergy(DeckFixtures.GOBLIN_GUIDE, Archetype.AGGRO), 1e-9);
        // base 0.4 + over the sweet spot -0.05
        assertEquals(0.35, scoring.archetypeSynergy(DeckFixtures.HOUR, Archetype.AGGRO), 1e-9);
        Card tutor = Card.builder("Demonic Tutor").manaCost("{1}{B}").typeLine("Sorcery")
                .oracleText("Search your library for a card, put that card into your hand, then shuffle.").build();
        // base 0.4 + "search" 0.08 + CMC 2 = min + 1 0.2 + tutor text 0.25, capped
        assertEquals(ScoringEngine.ARCHETYPE_CAP, scoring.archetypeSynergy(tutor, Archetype.COMBO), 1e-9);
    }

    @Test
    void testCurveSynergy() {
        DeckAnalysis gaps = DeckAnalyzer.analyze(DeckFixtures.missingTwoDrops());
        Card twoDrop = DeckFixtures.ADVERSARY;
        Card fiveDrop = DeckFixtures.THUNDERMAW;
        assertEquals(0.75, scoring.curveSynergy(twoDrop, gaps), 1e-9);
        assertEquals(0.25, scoring.curveSynergy(fiveDrop, gaps), 1e-9);
        assertEquals(0.5, scoring.curveSynergy(twoDrop, DeckAnalysis.empty()), 1e-9);
    }

    @Test
    void testThemeSynergy() {
        assertEquals(0.7, scoring.themeSynergy(DeckFixtures.CHAR, Theme.BURN, 28), 1e-9);
        assertEquals(0.3, scoring.themeSynergy(DeckFixtures.SWIFTSPEAR, Theme.BURN, 1), 1e-9);
        assertEquals(0.6, scoring.themeSynergy(DeckFixtures.CHAR, Theme.BURN, 2), 1e-9);
        assertEquals(0.2, scoring.themeSynergy(DeckFixtures.SWIFTSPEAR, Theme.BURN, 0), 1e-9);
    }

    @Test
    void testWeightedSynergy() {
        assertEquals(0.7 * 0.8 + 0.05, scoring.weightedSynergy(DeckFixtures.CHAR, 0.7, 0.8), 1e-9);
        assertEquals(0.7 * 0.8, scoring.weightedSynergy(DeckFixtures.HOUR, 0.7, 0.8), 1e-9);
        Card modal = DeckFixtures.spell("Charm", "{R}", "Instant", "Choose one — deal 2 damage.", Rarity.UNCOMMON);
        assertEquals(1.0, scoring.weightedSynergy(modal, 1.0, 1.0), 1e-9);
    }

    // ==================== META AND FIT ====================

    @Test
    void testMetaScore() {
        // uncommon 0.55 + "damage" 0.05
        assertEquals(0.6, scoring.metaScore(DeckFixtures.LIGHTNING_BOLT, Archetype.AGGRO), 1e-9);
        // mythic 0.65 + haste, creature 0.1
        assertEquals(0.75, scoring.metaScore(DeckFixtures.ADVERSARY, Archetype.AGGRO), 1e-9);
    }

    @Test
    void testDeckFitBounds() {
        DeckAnalysis analysis = DeckAnalyzer.analyze(DeckFixtures.monoRed());
        for (FormatPolicy policy : FormatPolicy.values()) {
            for (Card card : List.of(DeckFixtures.GOBLIN_GUIDE, DeckFixtures.HOUR, DeckFixtures.CHAR)) {
                double fit = scoring.deckFit(card, analysis, policy);
                assertTrue(fit >= 0.0 && fit <= 1.0, "fit out of range: " + fit);
            }
        }
        assertTrue(scoring.deckFit(DeckFixtures.GOBLIN_GUIDE, analysis, FormatPolicy.CONSTRUCTED)
                > scoring.deckFit(DeckFixtures.HOUR, analysis, FormatPolicy.CONSTRUCTED));
    }

    // ==================== RECOMMENDATION ====================

    @Test
    void testToRecommendation() {
        DeckAnalysis analysis = DeckAnalyzer.analyze(DeckFixtures.monoRed());
        ScoringEngine.Scores scores = scoring.score(DeckFixtures.GOBLIN_GUIDE, analysis,
                FormatPolicy.CONSTRUCTED, 0.85, 0.0);
        SmartRecommendation rec = scoring.toRecommendation(DeckFixtures.GOBLIN_GUIDE, scores,
                FormatPolicy.CONSTRUCTED, List.of("Lead reason", "Excellent synergy potential"));

        assertEquals("Goblin Guide", rec.name());
        assertEquals("{R}", rec.manaCost());
        assertEquals(85.0, rec.synergyScore());
        assertTrue(rec.confidence() >= 20.0 && rec.confidence() <= 98.0);
        assertEquals(CostConsideration.RARE_CRAFT, rec.costConsideration());
        assertEquals("2/2", rec.powerToughness());
        assertEquals(1, rec.cmc());

        List<String> reasons = rec.reasons();
        assertEquals("Lead reason", reasons.get(0));
        assertEquals("Excellent synergy potential", reasons.get(1));
        assertEquals(1, reasons.stream().filter("Excellent synergy potential"::equals).count());
        assertTrue(reasons.contains("Highly efficient (low CMC)"));
        assertTrue(reasons.contains("Powerful rare with strong effects"));
        assertTrue(reasons.contains("Keywords: haste"));
        assertTrue(reasons.size() <= 10);
    }

    @Test
    void testSingletonReasons() {
        List<String> reasons = scoring.signalReasons(DeckFixtures.GOBLIN_GUIDE, 0.02, FormatPolicy.SINGLETON);
        assertTrue(reasons.contains("Not playable in this color identity"));
        List<String> staple = scoring.signalReasons(DeckFixtures.GOBLIN_GUIDE, 0.9, FormatPolicy.SINGLETON);
        assertTrue(staple.contains("Excellent Commander staple"));
    }

    @Test
    void testPercent() {
        assertEquals(73.5, ScoringEngine.percent(0.7349));
        assertEquals(20.0, ScoringEngine.percent(0.2));
    }
}
