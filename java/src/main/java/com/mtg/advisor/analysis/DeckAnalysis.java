package com.mtg.advisor.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mtg.advisor.card.CardKeyword;
import com.mtg.advisor.card.CardType;
import com.mtg.advisor.card.ColorFlags;
import com.mtg.advisor.card.ManaColor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Structured summary of a deck's mainboard.
 *
 * @param strategy         coarse game plan
 * @param archetype        strategic classification
 * @param colors           colors present, WUBRG order
 * @param primaryColors    the (up to) two most represented colors
 * @param colorCounts      weighted count per color of identity
 * @param curve            non-land card count per mana value, 7+ bucketed at 7
 * @param typeDistribution weighted count per primary card type
 * @param themes           detected themes, most salient first
 * @param themeCounts      weighted count of cards touching each theme
 * @param keywordCounts    weighted count per keyword
 * @param totalCards       mainboard cards including lands
 * @param nonLandCards     mainboard cards excluding lands
 * @param averageCmc       mean mana value over non-land cards
 * @param health           structural health scores
 */
public record DeckAnalysis(
    Strategy strategy,
    Archetype archetype,
    List<ManaColor> colors,
    List<ManaColor> primaryColors,
    Map<ManaColor, Integer> colorCounts,
    SortedMap<Integer, Integer> curve,
    Map<CardType, Integer> typeDistribution,
    List<Theme> themes,
    Map<Theme, Integer> themeCounts,
    Map<CardKeyword, Integer> keywordCounts,
    int totalCards,
    int nonLandCards,
    double averageCmc,
    DeckHealth health
) {
    public static final int MAX_CURVE_BUCKET = 7;

    private static final DeckAnalysis EMPTY = new DeckAnalysis(
        Strategy.UNKNOWN, Archetype.UNKNOWN, List.of(), List.of(), Map.of(), new TreeMap<>(),
        Map.of(), List.of(), Map.of(), Map.of(), 0, 0, 0.0, DeckHealth.zero());

    public DeckAnalysis {
        colors = List.copyOf(colors);
        primaryColors = List.copyOf(primaryColors);
        colorCounts = Map.copyOf(colorCounts);
        curve = Collections.unmodifiableSortedMap(new TreeMap<>(curve));
        typeDistribution = Map.copyOf(typeDistribution);
        themes = List.copyOf(themes);
        themeCounts = Map.copyOf(themeCounts);
        keywordCounts = Map.copyOf(keywordCounts);
    }

    /**
     * Analysis of a deck with no mainboard cards.
     */
    public static DeckAnalysis empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return totalCards == 0;
    }

    @JsonIgnore
    public ColorFlags colorFlags() {
        return ColorFlags.of(colors);
    }

    /**
     * Keywords present in the deck, most frequent first (ties in vocabulary order).
     */
    @JsonProperty("keywords")
    public List<CardKeyword> keywords() {
        List<CardKeyword> keywords = new ArrayList<>(keywordCounts.keySet());
        keywords.sort(Comparator.<CardKeyword>comparingInt(k -> -keywordCounts.get(k))
            .thenComparing(Comparator.naturalOrder()));
        return keywords;
    }

    public int keywordCount(CardKeyword keyword) {
        return keywordCounts.getOrDefault(keyword, 0);
    }

    public int typeCount(CardType type) {
        return typeDistribution.getOrDefault(type, 0);
    }

    public boolean hasTheme(Theme theme) {
        return themes.contains(theme);
    }

    public int themeCount(Theme theme) {
        return themeCounts.getOrDefault(theme, 0);
    }

    // ==================== RATIOS ====================

    @JsonProperty("creatureRatio")
    public double creatureRatio() {
        return nonLandCards == 0 ? 0.0 : (double) typeCount(CardType.CREATURE) / nonLandCards;
    }

    /**
     * Share of instants and sorceries among non-land cards.
     */
    @JsonProperty("spellRatio")
    public double spellRatio() {
        if (nonLandCards == 0) {
            return 0.0;
        }
        return (double) (typeCount(CardType.INSTANT) + typeCount(CardType.SORCERY)) / nonLandCards;
    }

    public int curveCount(int cmc) {
        return curve.getOrDefault(Math.min(cmc, MAX_CURVE_BUCKET), 0);
    }

    /**
     * Share of non-land cards at the given mana value (7+ share bucket 7).
     */
    public double curveShare(int cmc) {
        return nonLandCards == 0 ? 0.0 : (double) curveCount(cmc) / nonLandCards;
    }

    /**
     * Share of non-land cards whose mana value lies in [from, to].
     */
    public double curveShare(int from, int to) {
        if (nonLandCards == 0) {
            return 0.0;
        }
        int count = 0;
        for (Map.Entry<Integer, Integer> entry : curve.entrySet()) {
            if (entry.getKey() >= from && entry.getKey() <= to) {
                count += entry.getValue();
            }
        }
        return (double) count / nonLandCards;
    }

    /**
     * Under-represented mana values, largest gap first. Empty decks have no gaps.
     */
    public List<CurveGap> curveGaps() {
        if (nonLandCards == 0) {
            return List.of();
        }
        List<CurveGap> gaps = new ArrayList<>();
        for (int cmc = 1; cmc <= 5; cmc++) {
            double ideal = CurveGap.IDEAL_SHARES.get(cmc);
            double actual = curveShare(cmc);
            if (actual < ideal * CurveGap.GAP_THRESHOLD) {
                gaps.add(new CurveGap(cmc, actual, ideal));
            }
        }
        gaps.sort(Comparator.comparingDouble(CurveGap::gapSize).reversed()
            .thenComparingInt(CurveGap::cmc));
        return gaps;
    }
}
