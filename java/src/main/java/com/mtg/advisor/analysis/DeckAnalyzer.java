package com.mtg.advisor.analysis;

import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.CardKeyword;
import com.mtg.advisor.card.CardType;
import com.mtg.advisor.card.ManaColor;
import com.mtg.advisor.deck.Deck;
import com.mtg.advisor.deck.DeckCard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deck structure analysis: curve, colors, types, themes, archetype and health.
 * Pure function of the deck's mainboard; every count is weighted by quantity.
 */
public final class DeckAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(DeckAnalyzer.class);

    // Curve health targets for early (1-2), mid (3-4) and late (5+) drops
    private static final double IDEAL_EARLY = 0.30;
    private static final double IDEAL_MID = 0.40;
    private static final double IDEAL_LATE = 0.30;

    private static final double CREATURE_BAND_MIN = 0.4;
    private static final double CREATURE_BAND_MAX = 0.6;
    private static final double SPELL_BAND_MIN = 0.2;
    private static final double SPELL_BAND_MAX = 0.4;

    private static final double EFFICIENT_CMC_MIN = 2.5;
    private static final double EFFICIENT_CMC_MAX = 3.5;

    private static final List<CardKeyword> AGGRESSIVE_KEYWORDS = List.of(
        CardKeyword.HASTE, CardKeyword.PROWESS, CardKeyword.FIRST_STRIKE, CardKeyword.MENACE);

    private DeckAnalyzer() {
        // Utility class - prevent instantiation
    }

    /**
     * Analyze the deck's mainboard. A missing or empty deck yields {@link DeckAnalysis#empty()}.
     */
    public static DeckAnalysis analyze(Deck deck) {
        if (deck == null) {
            return DeckAnalysis.empty();
        }
        return analyze(deck.getMainboard());
    }

    /**
     * Analyze a list of mainboard entries.
     */
    public static DeckAnalysis analyze(List<DeckCard> mainboard) {
        if (mainboard == null || mainboard.isEmpty()) {
            return DeckAnalysis.empty();
        }

        Map<ManaColor, Integer> colorCounts = new EnumMap<>(ManaColor.class);
        Map<CardType, Integer> typeCounts = new EnumMap<>(CardType.class);
        Map<CardKeyword, Integer> keywordCounts = new EnumMap<>(CardKeyword.class);
        Map<Theme, Integer> themeCounts = new EnumMap<>(Theme.class);
        TreeMap<Integer, Integer> curve = new TreeMap<>();
        int totalCards = 0;
        int nonLandCards = 0;
        long cmcSum = 0;

        for (DeckCard entry : mainboard) {
            Card card = entry.card();
            int quantity = entry.quantity();
            totalCards += quantity;

            for (ManaColor color : card.getColorIdentity().toList()) {
                colorCounts.merge(color, quantity, Integer::sum);
            }
            typeCounts.merge(card.getCardType(), quantity, Integer::sum);
            // Basic lands only carry mana reminder text
            if (!card.isBasicLand()) {
                for (CardKeyword keyword : card.getKeywords()) {
                    keywordCounts.merge(keyword, quantity, Integer::sum);
                }
                for (Theme theme : Theme.detect(card)) {
                    themeCounts.merge(theme, quantity, Integer::sum);
                }
            }

            if (!card.isLand()) {
                nonLandCards += quantity;
                cmcSum += (long) card.getCmc() * quantity;
                curve.merge(Math.min(card.getCmc(), DeckAnalysis.MAX_CURVE_BUCKET), quantity, Integer::sum);
            }
        }

        List<ManaColor> colors = new ArrayList<>();
        for (ManaColor color : ManaColor.WUBRG) {
            if (colorCounts.containsKey(color)) {
                colors.add(color);
            }
        }
        List<ManaColor> primaryColors = colors.stream()
            .sorted(Comparator.comparingInt((ManaColor c) -> -colorCounts.get(c))
                .thenComparingInt(ManaColor.WUBRG::indexOf))
            .limit(2)
            .toList();

        List<Theme> themes = new ArrayList<>(themeCounts.keySet());
        themes.sort(Comparator.comparingInt((Theme t) -> -themeCounts.get(t))
            .thenComparing(Comparator.naturalOrder()));

        double averageCmc = nonLandCards == 0 ? 0.0 : (double) cmcSum / nonLandCards;

        // Provisional record to reuse the ratio helpers for classification and health
        DeckAnalysis shape = new DeckAnalysis(Strategy.UNKNOWN, Archetype.UNKNOWN, colors, primaryColors,
            colorCounts, curve, typeCounts, themes, themeCounts, keywordCounts, totalCards, nonLandCards,
            averageCmc, DeckHealth.zero());

        Archetype archetype = classifyArchetype(shape);
        Strategy strategy = classifyStrategy(shape);
        DeckHealth health = scoreHealth(shape);

        log.debug("Analyzed {} cards: archetype={}, strategy={}, colors={}, avgCmc={}",
            totalCards, archetype, strategy, colors, String.format(Locale.ROOT, "%.2f", averageCmc));

        return new DeckAnalysis(strategy, archetype, colors, primaryColors, colorCounts, curve, typeCounts,
            themes, themeCounts, keywordCounts, totalCards, nonLandCards, averageCmc, health);
    }

    // ==================== CLASSIFICATION ====================

    static Archetype classifyArchetype(DeckAnalysis shape) {
        if (shape.isEmpty()) {
            return Archetype.UNKNOWN;
        }
        double creatureRatio = shape.creatureRatio();
        if (shape.averageCmc() < 3.0) {
            if (creatureRatio > 0.6) {
                return Archetype.AGGRO;
            }
            if (creatureRatio >= 0.4 && hasAggressiveSignal(shape)) {
                return Archetype.AGGRO;
            }
        }
        if (shape.keywordCount(CardKeyword.COUNTERSPELL) > 0 || shape.keywordCount(CardKeyword.CARD_DRAW) > 0) {
            return Archetype.CONTROL;
        }
        if (shape.averageCmc() > 4.0 && shape.keywordCount(CardKeyword.RAMP) > 0) {
            return Archetype.RAMP;
        }
        if (shape.keywordCount(CardKeyword.TUTOR) >= 2) {
            return Archetype.COMBO;
        }
        return Archetype.MIDRANGE;
    }

    private static boolean hasAggressiveSignal(DeckAnalysis shape) {
        if (shape.hasTheme(Theme.BURN)) {
            return true;
        }
        for (CardKeyword keyword : AGGRESSIVE_KEYWORDS) {
            if (shape.keywordCount(keyword) > 0) {
                return true;
            }
        }
        return false;
    }

    static Strategy classifyStrategy(DeckAnalysis shape) {
        if (shape.isEmpty()) {
            return Strategy.UNKNOWN;
        }
        if (shape.curveShare(1, 2) > 0.6 && shape.hasTheme(Theme.BURN)) {
            return Strategy.AGGRO;
        }
        if (shape.spellRatio() > 0.4 && shape.hasTheme(Theme.COUNTERSPELLS)) {
            return Strategy.CONTROL;
        }
        if (shape.curveShare(5, DeckAnalysis.MAX_CURVE_BUCKET) > 0.3) {
            return Strategy.RAMP;
        }
        if (shape.colors().size() >= 3) {
            return Strategy.MULTICOLOR;
        }
        return Strategy.MIDRANGE;
    }

    // ==================== HEALTH ====================

    static DeckHealth scoreHealth(DeckAnalysis shape) {
        if (shape.isEmpty()) {
            return DeckHealth.zero();
        }
        return DeckHealth.of(
            curveHealth(shape),
            colorConsistency(shape.colors().size()),
            cardBalance(shape),
            manaEfficiency(shape));
    }

    /**
     * Early/mid/late shares against a 30/40/30 split, each scored by distance.
     */
    static int curveHealth(DeckAnalysis shape) {
        if (shape.nonLandCards() == 0) {
            return 0;
        }
        double early = distanceScore(shape.curveShare(1, 2), IDEAL_EARLY);
        double mid = distanceScore(shape.curveShare(3, 4), IDEAL_MID);
        double late = distanceScore(shape.curveShare(5, DeckAnalysis.MAX_CURVE_BUCKET), IDEAL_LATE);
        return clampScore((early + mid + late) / 3.0);
    }

    static int colorConsistency(int colorCount) {
        if (colorCount <= 2) {
            return 90;
        }
        return switch (colorCount) {
            case 3 -> 70;
            case 4 -> 50;
            default -> 30;
        };
    }

    static int cardBalance(DeckAnalysis shape) {
        if (shape.nonLandCards() == 0) {
            return 0;
        }
        double creatures = bandScore(shape.creatureRatio(), CREATURE_BAND_MIN, CREATURE_BAND_MAX);
        double spells = bandScore(shape.spellRatio(), SPELL_BAND_MIN, SPELL_BAND_MAX);
        return clampScore((creatures + spells) / 2.0);
    }

    static int manaEfficiency(DeckAnalysis shape) {
        if (shape.nonLandCards() == 0) {
            return 0;
        }
        double avg = shape.averageCmc();
        if (avg >= EFFICIENT_CMC_MIN && avg <= EFFICIENT_CMC_MAX) {
            return 100;
        }
        return clampScore(100 - Math.abs(avg - 3.0) * 30);
    }

    private static double distanceScore(double actual, double ideal) {
        return Math.max(0, 100 - Math.abs(actual - ideal) * 200);
    }

    private static double bandScore(double ratio, double min, double max) {
        if (ratio >= min && ratio <= max) {
            return 100;
        }
        return distanceScore(ratio, (min + max) / 2.0);
    }

    private static int clampScore(double score) {
        return (int) Math.max(0, Math.min(100, Math.round(score)));
    }
}
