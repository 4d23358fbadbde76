package com.mtg.advisor.deck;

import com.mtg.advisor.card.Card;

import java.util.Objects;

/**
 * A card in a deck with its quantity and zone.
 */
public record DeckCard(Card card, int quantity, Zone zone) {

    public DeckCard {
        Objects.requireNonNull(card, "card");
        Objects.requireNonNull(zone, "zone");
        if (quantity < 1) {
            throw new IllegalArgumentException("Quantity must be at least 1 for " + card.getName());
        }
    }

    public static DeckCard mainboard(Card card, int quantity) {
        return new DeckCard(card, quantity, Zone.MAINBOARD);
    }

    public static DeckCard sideboard(Card card, int quantity) {
        return new DeckCard(card, quantity, Zone.SIDEBOARD);
    }

    public DeckCard withQuantity(int newQuantity) {
        return new DeckCard(card, newQuantity, zone);
    }
}
