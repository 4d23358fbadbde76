package com.mtg.advisor.recommend;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.mtg.advisor.card.CardKeyword;
import com.mtg.advisor.card.ManaColor;
import com.mtg.advisor.card.Rarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A scored card suggestion. Scores are percentages in [0, 100]; confidence never leaves [20, 98].
 *
 * @param name               card name
 * @param manaCost           mana cost text
 * @param type               full type line
 * @param rarity             card rarity
 * @param confidence         overall confidence
 * @param synergyScore       fit with the deck's colors, plan or themes
 * @param metaScore          metagame relevance
 * @param deckFit            structural fit with the deck
 * @param costConsideration  owned, or the craft tier for the card's rarity
 * @param reasons            human-readable reasons, most important first
 * @param cmc                mana value
 * @param colorIdentity      the card's color identity
 * @param legality           per-format legality, passed through for display
 * @param oracleText         rules text, passed through for display
 * @param powerToughness     "P/T" for creatures, null otherwise
 * @param keywords           keywords found in the rules text
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SmartRecommendation(
    String name,
    String manaCost,
    String type,
    Rarity rarity,
    double confidence,
    double synergyScore,
    double metaScore,
    double deckFit,
    CostConsideration costConsideration,
    List<String> reasons,
    int cmc,
    List<ManaColor> colorIdentity,
    Map<String, String> legality,
    String oracleText,
    String powerToughness,
    List<CardKeyword> keywords
) {
    public static final double MIN_CONFIDENCE = 20.0;
    public static final double MAX_CONFIDENCE = 98.0;

    public SmartRecommendation {
        if (confidence < MIN_CONFIDENCE || confidence > MAX_CONFIDENCE) {
            throw new IllegalArgumentException("confidence out of range for " + name + ": " + confidence);
        }
        requirePercent("synergyScore", synergyScore);
        requirePercent("metaScore", metaScore);
        requirePercent("deckFit", deckFit);
        reasons = List.copyOf(reasons);
        colorIdentity = List.copyOf(colorIdentity);
        legality = legality == null ? Map.of() : Map.copyOf(legality);
        keywords = List.copyOf(keywords);
    }

    @JsonIgnore
    public boolean isOwned() {
        return costConsideration == CostConsideration.OWNED;
    }

    /**
     * Copy marked as owned, with the ownership reason in front of the others.
     */
    public SmartRecommendation withOwnership(int quantity) {
        List<String> ownedReasons = new ArrayList<>(reasons.size() + 1);
        ownedReasons.add(ownershipReason(quantity));
        ownedReasons.addAll(reasons);
        return new SmartRecommendation(name, manaCost, type, rarity, confidence, synergyScore, metaScore, deckFit,
            CostConsideration.OWNED, ownedReasons, cmc, colorIdentity, legality, oracleText, powerToughness, keywords);
    }

    /**
     * Copy with the craft tier for this card's rarity.
     */
    public SmartRecommendation withCraftCost() {
        return new SmartRecommendation(name, manaCost, type, rarity, confidence, synergyScore, metaScore, deckFit,
            CostConsideration.fromRarity(rarity), reasons, cmc, colorIdentity, legality, oracleText,
            powerToughness, keywords);
    }

    public static String ownershipReason(int quantity) {
        return "✅ Already in collection (" + quantity + "x)";
    }

    private static void requirePercent(String field, double value) {
        if (value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(field + " must be in [0, 100]: " + value);
        }
    }
}
