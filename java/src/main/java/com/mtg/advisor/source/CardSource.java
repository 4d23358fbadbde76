package com.mtg.advisor.source;

import com.mtg.advisor.card.Card;

import java.util.List;
import java.util.Optional;

/**
 * Card-data service contract: free-text search and exact-name lookup.
 */
public interface CardSource {

    /**
     * Run a search query. An empty list means nothing matched.
     *
     * @throws CardSourceException when the service cannot answer
     */
    List<Card> search(String query, SearchOptions options) throws CardSourceException;

    /**
     * Look up one card by exact name (case-insensitive).
     *
     * @throws CardSourceException when the service cannot answer
     */
    Optional<Card> getByName(String name) throws CardSourceException;
}
