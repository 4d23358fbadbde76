package com.mtg.advisor.deck;

import com.mtg.advisor.card.CardNames;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Owned cards: normalized card name to owned quantity. Read-only input to the engine.
 */
public final class Collection {
    private static final Collection EMPTY = new Collection(Map.of());

    private final Map<String, Integer> quantities;

    private Collection(Map<String, Integer> quantities) {
        this.quantities = quantities;
    }

    public static Collection empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Owned copies of a card, 0 if not owned. Case-insensitive.
     */
    public int quantityOf(String cardName) {
        return quantities.getOrDefault(CardNames.normalize(cardName), 0);
    }

    public boolean owns(String cardName) {
        return quantityOf(cardName) > 0;
    }

    public int uniqueCards() {
        return quantities.size();
    }

    public int totalCards() {
        return quantities.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(quantities);
    }

    public static final class Builder {
        private final Map<String, Integer> quantities = new HashMap<>();

        private Builder() {
        }

        public Builder add(String cardName, int quantity) {
            Objects.requireNonNull(cardName, "cardName");
            if (quantity > 0) {
                quantities.merge(CardNames.normalize(cardName), quantity, Integer::sum);
            }
            return this;
        }

        public Collection build() {
            return new Collection(new HashMap<>(quantities));
        }
    }
}
