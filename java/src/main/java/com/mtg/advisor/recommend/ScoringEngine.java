package com.mtg.advisor.recommend;

import com.mtg.advisor.analysis.Archetype;
import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.analysis.Theme;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.CardKeyword;
import com.mtg.advisor.card.CardType;
import com.mtg.advisor.card.ColorFlags;
import com.mtg.advisor.card.Rarity;
import com.mtg.advisor.rng.ScoreJitter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Heuristic card scoring. Every score is built from bounded factors; confidence is
 * their geometric mean so no single factor can push a card to certainty.
 * <p>
 * All methods work on fractions in [0, 1]; {@link #toRecommendation} converts to percentages.
 */
public class ScoringEngine {

    // ==================== CONFIDENCE FACTORS ====================

    /** Synergy factor = base + synergy * span, so [0.5, 0.9]. */
    public static final double SYNERGY_FACTOR_BASE = 0.5;
    public static final double SYNERGY_FACTOR_SPAN = 0.4;

    public static final Map<Rarity, Double> RARITY_FACTORS = Map.of(
        Rarity.COMMON, 0.65,
        Rarity.UNCOMMON, 0.75,
        Rarity.RARE, 0.85,
        Rarity.MYTHIC, 0.95
    );

    public static final double TYPE_FACTOR_PERFECT = 0.9;
    public static final double TYPE_FACTOR_GOOD = 0.85;
    public static final double TYPE_FACTOR_PLANESWALKER = 0.88;
    public static final double TYPE_FACTOR_CREATURE = 0.75;
    public static final double TYPE_FACTOR_SPELL = 0.7;
    public static final double TYPE_FACTOR_OTHER = 0.65;

    public static final double CONFIDENCE_FLOOR = 0.20;
    public static final double CONFIDENCE_CEILING = 0.98;
    public static final double CONFIDENCE_JITTER = 0.02;

    // ==================== STAPLE FACTORS ====================

    public static final double STAPLE_LEGAL_FACTOR = 0.9;
    public static final double STAPLE_NOT_LEGAL_FACTOR = 0.6;

    public static final Map<Rarity, Double> STAPLE_RARITY_FACTORS = Map.of(
        Rarity.COMMON, 0.68,
        Rarity.UNCOMMON, 0.78,
        Rarity.RARE, 0.88,
        Rarity.MYTHIC, 0.95
    );

    public static final double STAPLE_FLOOR = 0.35;
    public static final double STAPLE_CEILING = 0.95;
    public static final double STAPLE_JITTER = 0.03;

    /** Metagame relevance given to format staples regardless of their text. */
    public static final double STAPLE_META_WEIGHT = 0.85;

    // ==================== SYNERGY ====================

    public static final double ARCHETYPE_BASE = 0.4;
    public static final double ARCHETYPE_KEYWORD_STEP = 0.08;
    public static final double ARCHETYPE_KEYWORD_CAP = 0.25;
    public static final double ARCHETYPE_CAP = 0.85;

    /** Ideal share per mana value used by curve synergy; anything else is 0.5%. */
    public static final Map<Integer, Double> CURVE_IDEAL_SHARES = Map.of(
        1, 0.20, 2, 0.30, 3, 0.25, 4, 0.15, 5, 0.08, 6, 0.02, 7, 0.01);
    public static final double CURVE_IDEAL_DEFAULT = 0.005;

    public static final double EFFICIENT_CARD_BONUS = 0.05;
    public static final double VERSATILE_CARD_BONUS = 0.1;

    public static final double META_BASE = 0.5;
    public static final double META_TERM_STEP = 0.05;
    public static final Map<Rarity, Double> META_RARITY_MULTIPLIERS = Map.of(
        Rarity.COMMON, 1.0,
        Rarity.UNCOMMON, 1.1,
        Rarity.RARE, 1.2,
        Rarity.MYTHIC, 1.3
    );

    private static final List<String> VERSATILE_TERMS = List.of("choose", "either", "mode", "additional cost");
    private static final List<String> MULTI_USE_TERMS = List.of("{t}:", "activated ability", "enters");

    private final boolean jitter;

    public ScoringEngine() {
        this(true);
    }

    /**
     * @param jitter whether to add the per-card deterministic jitter to confidence
     */
    public ScoringEngine(boolean jitter) {
        this.jitter = jitter;
    }

    /**
     * Component scores for one card, as fractions.
     */
    public record Scores(double confidence, double synergy, double meta, double deckFit) {}

    // ==================== CONFIDENCE ====================

    /**
     * Geometric mean of the six confidence factors plus jitter, clamped to [0.20, 0.98].
     */
    public double confidence(Card card, Archetype archetype, double synergy) {
        return confidence(card, archetype, synergy, 0.0);
    }

    /**
     * Confidence with an extra bonus added before clamping.
     */
    public double confidence(Card card, Archetype archetype, double synergy, double bonus) {
        double value = geometricMean(confidenceFactors(card, archetype, synergy));
        value += jitter(card, CONFIDENCE_JITTER) + bonus;
        return clamp(value, CONFIDENCE_FLOOR, CONFIDENCE_CEILING);
    }

    public List<Double> confidenceFactors(Card card, Archetype archetype, double synergy) {
        return List.of(
            SYNERGY_FACTOR_BASE + clamp(synergy, 0.0, 1.0) * SYNERGY_FACTOR_SPAN,
            RARITY_FACTORS.get(card.getRarity()),
            cmcFactor(card.getCmc()),
            typeFactor(card.getCardType(), archetype),
            complexityFactor(card.getOracleText().length()),
            keywordFactor(card.getKeywords().size())
        );
    }

    static double cmcFactor(int cmc) {
        if (cmc <= 1) {
            return 0.9;
        }
        return switch (cmc) {
            case 2 -> 0.85;
            case 3 -> 0.8;
            case 4 -> 0.75;
            case 5 -> 0.7;
            case 6 -> 0.6;
            default -> 0.5;
        };
    }

    static double typeFactor(CardType type, Archetype archetype) {
        if (archetype == Archetype.AGGRO && type == CardType.CREATURE) {
            return TYPE_FACTOR_PERFECT;
        }
        if (archetype == Archetype.CONTROL && type.isSpell()) {
            return TYPE_FACTOR_PERFECT;
        }
        if ((archetype == Archetype.MIDRANGE || archetype == Archetype.UNKNOWN) && type == CardType.CREATURE) {
            return TYPE_FACTOR_GOOD;
        }
        return switch (type) {
            case PLANESWALKER -> TYPE_FACTOR_PLANESWALKER;
            case CREATURE -> TYPE_FACTOR_CREATURE;
            case INSTANT, SORCERY -> TYPE_FACTOR_SPELL;
            default -> TYPE_FACTOR_OTHER;
        };
    }

    /**
     * Longer rules text tends to mean a more powerful card.
     */
    static double complexityFactor(int textLength) {
        if (textLength > 120) {
            return 0.9;
        } else if (textLength > 80) {
            return 0.85;
        } else if (textLength > 40) {
            return 0.8;
        } else if (textLength > 15) {
            return 0.75;
        }
        return 0.65;
    }

    static double keywordFactor(int keywordCount) {
        if (keywordCount >= 3) {
            return 0.9;
        }
        return switch (keywordCount) {
            case 2 -> 0.85;
            case 1 -> 0.8;
            default -> 0.7;
        };
    }

    /**
     * Confidence for a format staple: legality, rarity, mana value, text and type, clamped to [0.35, 0.95].
     */
    public double stapleConfidence(Card card, String format) {
        List<Double> factors = List.of(
            card.isLegalIn(format) ? STAPLE_LEGAL_FACTOR : STAPLE_NOT_LEGAL_FACTOR,
            STAPLE_RARITY_FACTORS.get(card.getRarity()),
            stapleCmcFactor(card.getCmc()),
            stapleTextFactor(card.getOracleText().length()),
            stapleTypeFactor(card.getCardType())
        );
        double value = geometricMean(factors) + jitter(card, STAPLE_JITTER);
        return clamp(value, STAPLE_FLOOR, STAPLE_CEILING);
    }

    static double stapleCmcFactor(int cmc) {
        if (cmc <= 1) {
            return 0.95;
        }
        return switch (cmc) {
            case 2 -> 0.9;
            case 3 -> 0.85;
            case 4 -> 0.8;
            case 5 -> 0.75;
            case 6 -> 0.65;
            default -> 0.55;
        };
    }

    static double stapleTextFactor(int textLength) {
        if (textLength > 100) {
            return 0.9;
        } else if (textLength > 60) {
            return 0.85;
        } else if (textLength > 30) {
            return 0.8;
        } else if (textLength > 10) {
            return 0.75;
        }
        return 0.65;
    }

    static double stapleTypeFactor(CardType type) {
        return switch (type) {
            case PLANESWALKER -> 0.92;
            case INSTANT, SORCERY -> 0.85;
            case CREATURE -> 0.82;
            case ARTIFACT, ENCHANTMENT -> 0.78;
            default -> 0.7;
        };
    }

    // ==================== SYNERGY ====================

    /**
     * Color fit of a card for the deck under the given policy.
     */
    public double colorSynergy(Card card, ColorFlags deckColors, FormatPolicy policy) {
        return colorSynergy(policy.relevantColors(card), deckColors, policy);
    }

    /**
     * Color fit of a card's colors for the deck's colors. Singleton formats collapse
     * off-identity cards to 0.05 (some overlap) or 0.02 (none); constructed formats
     * degrade from 0.85 down to 0.15.
     */
    public double colorSynergy(ColorFlags cardColors, ColorFlags deckColors, FormatPolicy policy) {
        boolean singleton = policy.isSingleton();
        if (deckColors.isEmpty()) {
            return cardColors.isEmpty() ? 0.6 : 0.4;
        }
        if (cardColors.isEmpty()) {
            return singleton ? 0.75 : 0.7;
        }

        int overlap = cardColors.intersect(deckColors).count();
        if (cardColors.isSubsetOf(deckColors)) {
            int deckSize = deckColors.count();
            if (singleton) {
                return switch (deckSize) {
                    case 1 -> 0.88 + overlap * 0.05;
                    case 2 -> 0.82 + overlap * 0.06;
                    case 3 -> 0.78 + overlap * 0.07;
                    default -> Math.min(0.75 + overlap * 0.08, 1.0);
                };
            }
            return switch (deckSize) {
                case 1 -> 0.75 + overlap * 0.05;
                case 2 -> 0.65 + overlap * 0.08;
                default -> Math.min(0.55 + overlap * 0.1, 0.85);
            };
        }

        if (singleton) {
            return overlap > 0 ? 0.05 : 0.02;
        }
        if (overlap > 0) {
            double ratio = (double) overlap / cardColors.count();
            return 0.3 + ratio * 0.25;
        }
        return 0.15;
    }

    /**
     * How well a card plays into an archetype: rules-text signals, CMC sweet spot and a
     * type bonus on a 0.4 base, capped at 0.85.
     */
    public double archetypeSynergy(Card card, Archetype archetype) {
        String text = card.getOracleText().toLowerCase(Locale.ROOT);
        double score = ARCHETYPE_BASE;

        int matches = 0;
        for (String term : archetype.getSynergyTerms()) {
            if (text.contains(term)) {
                matches++;
            }
        }
        score += Math.min(matches * ARCHETYPE_KEYWORD_STEP, ARCHETYPE_KEYWORD_CAP);

        int cmc = card.getCmc();
        int min = archetype.getSweetSpotMin();
        int max = archetype.getSweetSpotMax();
        if (cmc >= min && cmc <= max) {
            score += cmc == min + 1 ? 0.2 : 0.1;
        } else if (cmc < min) {
            score += 0.05;
        } else {
            score -= 0.05;
        }

        score += switch (archetype) {
            case AGGRO -> card.getCardType() == CardType.CREATURE ? 0.15 : 0.0;
            case CONTROL -> card.getCardType().isSpell() ? 0.2 : 0.0;
            case COMBO -> containsAny(text, List.of("search", "tutor", "sacrifice")) ? 0.25 : 0.0;
            case RAMP -> card.hasKeyword(CardKeyword.RAMP) ? 0.15 : 0.0;
            case MIDRANGE, UNKNOWN -> containsAny(text, List.of("choose", "either", "mode")) ? 0.1 : 0.0;
        };

        return clamp(score, 0.0, ARCHETYPE_CAP);
    }

    /**
     * How much the deck needs a card at this mana value, from 0.25 (oversaturated) to 0.75 (big gap).
     */
    public double curveSynergy(Card card, DeckAnalysis analysis) {
        if (analysis.nonLandCards() == 0) {
            return 0.5;
        }
        int cmc = card.getCmc();
        double gap = CURVE_IDEAL_SHARES.getOrDefault(cmc, CURVE_IDEAL_DEFAULT) - analysis.curveShare(cmc);
        if (gap > 0.15) {
            return 0.75;
        } else if (gap > 0.10) {
            return 0.65;
        } else if (gap > 0.05) {
            return 0.55;
        } else if (gap > -0.05) {
            return 0.45;
        } else if (gap > -0.10) {
            return 0.35;
        }
        return 0.25;
    }

    /**
     * Theme fit: 0.4 when the card itself carries the theme (0.2 otherwise), plus a
     * bonus for how many deck cards already share it.
     */
    public double themeSynergy(Card card, Theme theme, int deckThemeCount) {
        double score = theme.matches(card) ? 0.4 : 0.2;
        if (deckThemeCount >= 3) {
            score += 0.3;
        } else if (deckThemeCount >= 2) {
            score += 0.2;
        } else if (deckThemeCount >= 1) {
            score += 0.1;
        }
        return Math.min(score, 1.0);
    }

    /**
     * Scale a synergy by its query's weight, rewarding cheap and modal cards.
     */
    public double weightedSynergy(Card card, double base, double weight) {
        double score = base * weight;
        if (card.getCmc() <= 3) {
            score += EFFICIENT_CARD_BONUS;
        }
        if (containsAny(card.getOracleText().toLowerCase(Locale.ROOT), List.of("choose", "either"))) {
            score += VERSATILE_CARD_BONUS;
        }
        return Math.min(score, 1.0);
    }

    // ==================== META AND FIT ====================

    /**
     * Metagame relevance: rarity-scaled base plus a step per archetype term in the card's text or type.
     */
    public double metaScore(Card card, Archetype archetype) {
        double score = META_BASE * META_RARITY_MULTIPLIERS.get(card.getRarity());
        String text = card.getOracleText().toLowerCase(Locale.ROOT);
        String typeLine = card.getTypeLine().toLowerCase(Locale.ROOT);
        for (String term : archetype.getMetaTerms()) {
            if (text.contains(term) || typeLine.contains(term)) {
                score += META_TERM_STEP;
            }
        }
        return Math.min(score, 1.0);
    }

    /**
     * Structural fit: colors, curve and archetype weighted by format family, plus
     * bonuses for modal and multi-use cards.
     */
    public double deckFit(Card card, DeckAnalysis analysis, FormatPolicy policy) {
        boolean singleton = policy.isSingleton();
        double score = 0.4;
        score += colorSynergy(card, analysis.colorFlags(), policy) * (singleton ? 0.4 : 0.25);
        score += curveSynergy(card, analysis) * (singleton ? 0.15 : 0.25);
        score += archetypeSynergy(card, analysis.archetype()) * (singleton ? 0.25 : 0.30);

        String text = card.getOracleText().toLowerCase(Locale.ROOT);
        if (containsAny(text, VERSATILE_TERMS)) {
            score += 0.15;
        }
        if (containsAny(text, MULTI_USE_TERMS)) {
            score += 0.05;
        }
        return Math.min(score, 1.0);
    }

    /**
     * Scores for a card from a synergy value computed by the caller.
     */
    public Scores score(Card card, DeckAnalysis analysis, FormatPolicy policy, double synergy, double confidenceBonus) {
        return new Scores(
            confidence(card, analysis.archetype(), synergy, confidenceBonus),
            synergy,
            metaScore(card, analysis.archetype()),
            deckFit(card, analysis, policy));
    }

    // ==================== RECOMMENDATION ====================

    /**
     * Build the recommendation. The caller's reasons come first, followed by reasons
     * derived from the same signals that drove the scores.
     */
    public SmartRecommendation toRecommendation(Card card, Scores scores, FormatPolicy policy, List<String> leadReasons) {
        Set<String> reasons = new LinkedHashSet<>(leadReasons);
        reasons.addAll(signalReasons(card, scores.synergy(), policy));

        return new SmartRecommendation(
            card.getName(),
            card.getManaCost().getText(),
            card.getTypeLine(),
            card.getRarity(),
            percent(clamp(scores.confidence(), CONFIDENCE_FLOOR, CONFIDENCE_CEILING)),
            percent(clamp(scores.synergy(), 0.0, 1.0)),
            percent(clamp(scores.meta(), 0.0, 1.0)),
            percent(clamp(scores.deckFit(), 0.0, 1.0)),
            CostConsideration.fromRarity(card.getRarity()),
            new ArrayList<>(reasons).subList(0, Math.min(reasons.size(), 10)),
            card.getCmc(),
            card.getColorIdentity().toList(),
            card.getLegalities(),
            card.getOracleText(),
            card.getPowerToughness(),
            card.getKeywords());
    }

    List<String> signalReasons(Card card, double synergy, FormatPolicy policy) {
        List<String> reasons = new ArrayList<>();

        if (synergy > 0.8) {
            reasons.add(policy.isSingleton() ? "Excellent Commander staple" : "Excellent synergy potential");
        } else if (synergy > 0.6) {
            reasons.add("Good synergy with current cards");
        } else if (synergy > 0.4) {
            reasons.add("Reasonable fit for deck");
        } else if (synergy < 0.2 && policy.isSingleton()) {
            reasons.add("Not playable in this color identity");
        }

        if (!card.isLand()) {
            if (card.getCmc() <= 1) {
                reasons.add("Highly efficient (low CMC)");
            } else if (card.getCmc() <= 3) {
                reasons.add("Efficient mana cost");
            }
        }

        reasons.add(switch (card.getRarity()) {
            case MYTHIC, RARE -> "Powerful " + card.getRarity().getJsonValue() + " with strong effects";
            case UNCOMMON -> "Solid uncommon with good value";
            case COMMON -> "Accessible common with consistent effects";
        });

        List<CardKeyword> keywords = card.getKeywords();
        if (!keywords.isEmpty()) {
            StringBuilder sb = new StringBuilder("Keywords: ");
            for (int i = 0; i < Math.min(3, keywords.size()); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(keywords.get(i).getLabel());
            }
            reasons.add(sb.toString());
        }

        if (containsAny(card.getOracleText().toLowerCase(Locale.ROOT), List.of("choose", "either"))) {
            reasons.add("Versatile with multiple modes");
        }
        return reasons;
    }

    // ==================== HELPERS ====================

    private double jitter(Card card, double amplitude) {
        return jitter ? ScoreJitter.of(card.getName(), amplitude) : 0.0;
    }

    static double geometricMean(List<Double> factors) {
        double product = 1.0;
        for (double factor : factors) {
            product *= factor;
        }
        return Math.pow(product, 1.0 / factors.size());
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Fraction to percentage with one decimal.
     */
    static double percent(double fraction) {
        return Math.round(fraction * 1000.0) / 10.0;
    }

    private static boolean containsAny(String text, List<String> terms) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
