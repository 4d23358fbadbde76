package com.mtg.advisor.card;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A card as fetched from the card-data service. Immutable once built.
 * Missing fields are defaulted rather than rejected: no mana cost means CMC 0,
 * no type line means "Unknown".
 */
public final class Card {
    public static final String UNKNOWN_TYPE_LINE = "Unknown";

    private final String name;
    private final ManaCost manaCost;
    private final int cmc;
    private final String typeLine;
    private final CardType cardType;
    private final ColorFlags colors;
    private final ColorFlags colorIdentity;
    private final Rarity rarity;
    private final String oracleText;
    private final Map<String, String> legalities;
    private final List<CardKeyword> keywords;
    private final String power;
    private final String toughness;
    private final String setCode;

    private Card(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.manaCost = ManaCost.parse(builder.manaCost);
        this.cmc = builder.cmc != null ? Math.max(0, builder.cmc) : manaCost.getCMC();
        this.typeLine = builder.typeLine == null || builder.typeLine.isBlank()
                ? UNKNOWN_TYPE_LINE : builder.typeLine;
        this.cardType = CardType.fromTypeLine(typeLine);
        this.colors = builder.colors != null ? builder.colors : manaCost.getColors();
        // Identity is always a superset of the card's colors
        this.colorIdentity = builder.colorIdentity != null
                ? builder.colorIdentity.union(colors) : colors;
        this.rarity = builder.rarity != null ? builder.rarity : Rarity.COMMON;
        this.oracleText = builder.oracleText != null ? builder.oracleText : "";
        this.legalities = Map.copyOf(builder.legalities);
        this.keywords = CardKeyword.extract(oracleText);
        this.power = builder.power;
        this.toughness = builder.toughness;
        this.setCode = builder.setCode;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getNormalizedName() {
        return CardNames.normalize(name);
    }

    public ManaCost getManaCost() {
        return manaCost;
    }

    public int getCmc() {
        return cmc;
    }

    public String getTypeLine() {
        return typeLine;
    }

    public CardType getCardType() {
        return cardType;
    }

    public ColorFlags getColors() {
        return colors;
    }

    public ColorFlags getColorIdentity() {
        return colorIdentity;
    }

    public Rarity getRarity() {
        return rarity;
    }

    public String getOracleText() {
        return oracleText;
    }

    public Map<String, String> getLegalities() {
        return legalities;
    }

    public List<CardKeyword> getKeywords() {
        return keywords;
    }

    public boolean hasKeyword(CardKeyword keyword) {
        return keywords.contains(keyword);
    }

    public String getPower() {
        return power;
    }

    public String getToughness() {
        return toughness;
    }

    public String getSetCode() {
        return setCode;
    }

    public boolean isLand() {
        return cardType == CardType.LAND;
    }

    public boolean isBasicLand() {
        return CardNames.isBasicLand(typeLine);
    }

    /**
     * Check legality in a format. Cards without legality data are assumed legal.
     */
    public boolean isLegalIn(String format) {
        if (legalities.isEmpty() || format == null) {
            return true;
        }
        String status = legalities.get(format.toLowerCase(Locale.ROOT));
        return status == null || "legal".equals(status) || "restricted".equals(status);
    }

    /**
     * "P/T" for creatures, null otherwise.
     */
    public String getPowerToughness() {
        if (power == null || toughness == null) {
            return null;
        }
        return power + "/" + toughness;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Card other && other.getNormalizedName().equals(getNormalizedName());
    }

    @Override
    public int hashCode() {
        return getNormalizedName().hashCode();
    }

    @Override
    public String toString() {
        return name + " " + manaCost + " (" + typeLine + ")";
    }

    public static final class Builder {
        private final String name;
        private String manaCost;
        private Integer cmc;
        private String typeLine;
        private ColorFlags colors;
        private ColorFlags colorIdentity;
        private Rarity rarity;
        private String oracleText;
        private final Map<String, String> legalities = new LinkedHashMap<>();
        private String power;
        private String toughness;
        private String setCode;

        private Builder(String name) {
            this.name = name;
        }

        public Builder manaCost(String manaCost) { this.manaCost = manaCost; return this; }
        public Builder cmc(Integer cmc) { this.cmc = cmc; return this; }
        public Builder typeLine(String typeLine) { this.typeLine = typeLine; return this; }
        public Builder colors(ColorFlags colors) { this.colors = colors; return this; }
        public Builder colorIdentity(ColorFlags colorIdentity) { this.colorIdentity = colorIdentity; return this; }
        public Builder rarity(Rarity rarity) { this.rarity = rarity; return this; }
        public Builder oracleText(String oracleText) { this.oracleText = oracleText; return this; }
        public Builder power(String power) { this.power = power; return this; }
        public Builder toughness(String toughness) { this.toughness = toughness; return this; }
        public Builder setCode(String setCode) { this.setCode = setCode; return this; }

        public Builder legality(String format, String status) {
            this.legalities.put(format.toLowerCase(Locale.ROOT), status);
            return this;
        }

        public Builder legalities(Map<String, String> legalities) {
            legalities.forEach(this::legality);
            return this;
        }

        public Card build() {
            return new Card(this);
        }
    }
}
