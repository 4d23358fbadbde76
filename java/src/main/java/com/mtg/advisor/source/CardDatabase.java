package com.mtg.advisor.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.CardNames;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Local card database loaded from a JSON array of Scryfall card objects
 * (or a Scryfall "list" object). Lookups are case-insensitive.
 */
public class CardDatabase {
    private final Map<String, Card> cards;

    private CardDatabase(Map<String, Card> cards) {
        this.cards = cards;
    }

    /**
     * Load cards from a JSON file.
     */
    public static CardDatabase fromFile(Path path) throws CardSourceException {
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new CardSourceException("Failed to read card database " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource.
     */
    public static CardDatabase fromResource(String resourcePath) throws CardSourceException {
        try (InputStream is = CardDatabase.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardSourceException("Resource not found: " + resourcePath);
            }
            return fromTree(new ObjectMapper().readTree(is));
        } catch (IOException e) {
            throw new CardSourceException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string.
     */
    public static CardDatabase fromJson(String json) throws CardSourceException {
        try {
            return fromTree(new ObjectMapper().readTree(json));
        } catch (IOException e) {
            throw new CardSourceException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static CardDatabase fromTree(JsonNode root) throws CardSourceException {
        JsonNode array = root.isArray() ? root : root.path("data");
        if (!array.isArray()) {
            throw new CardSourceException("Expected an array of cards or a list object");
        }
        Map<String, Card> cards = new HashMap<>();
        for (JsonNode node : array) {
            if (node.hasNonNull("name")) {
                Card card = ScryfallCardMapper.fromCard(node);
                cards.putIfAbsent(card.getNormalizedName(), card);
            }
        }
        return new CardDatabase(cards);
    }

    public Optional<Card> find(String name) {
        return Optional.ofNullable(cards.get(CardNames.normalize(name)));
    }

    public int cardCount() {
        return cards.size();
    }

    public boolean hasCard(String name) {
        return cards.containsKey(CardNames.normalize(name));
    }
}
