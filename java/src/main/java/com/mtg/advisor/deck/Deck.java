package com.mtg.advisor.deck;

import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.CardNames;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Deck representation: an ordered, zone-partitioned list of cards plus metadata.
 * The playset limit is enforced by whoever edits decks, not here.
 */
public class Deck {
    public static final int PLAYSET_LIMIT = 4;

    private final String name;
    private final String format;
    private final List<DeckCard> cards;
    private final Instant createdAt;
    private Instant lastModified;

    public Deck(String name, String format, List<DeckCard> cards) {
        this(name, format, cards, Instant.now());
    }

    public Deck(String name, String format, List<DeckCard> cards, Instant createdAt) {
        this.name = Objects.requireNonNull(name, "name");
        this.format = format == null || format.isBlank() ? "standard" : format;
        this.cards = new ArrayList<>(cards);
        this.createdAt = createdAt;
        this.lastModified = createdAt;
    }

    /**
     * Add copies of a card, merging with an existing entry in the same zone.
     */
    public void addCard(Card card, int quantity, Zone zone) {
        for (int i = 0; i < cards.size(); i++) {
            DeckCard existing = cards.get(i);
            if (existing.zone() == zone && existing.card().equals(card)) {
                cards.set(i, existing.withQuantity(existing.quantity() + quantity));
                touch();
                return;
            }
        }
        cards.add(new DeckCard(card, quantity, zone));
        touch();
    }

    public List<DeckCard> getCards() {
        return new ArrayList<>(cards);
    }

    public List<DeckCard> getMainboard() {
        return cards.stream().filter(c -> c.zone() == Zone.MAINBOARD).toList();
    }

    public List<DeckCard> getSideboard() {
        return cards.stream().filter(c -> c.zone() == Zone.SIDEBOARD).toList();
    }

    /**
     * Normalized names of every mainboard card.
     */
    public Set<String> getMainboardNames() {
        Set<String> names = new LinkedHashSet<>();
        for (DeckCard deckCard : getMainboard()) {
            names.add(CardNames.normalize(deckCard.card().getName()));
        }
        return names;
    }

    public int size() {
        return getMainboard().stream().mapToInt(DeckCard::quantity).sum();
    }

    public boolean isEmpty() {
        return getMainboard().isEmpty();
    }

    public String getName() {
        return name;
    }

    public String getFormat() {
        return format;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    private void touch() {
        this.lastModified = Instant.now();
    }
}
