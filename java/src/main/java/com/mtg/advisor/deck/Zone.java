package com.mtg.advisor.deck;

/**
 * Deck partition a card belongs to.
 */
public enum Zone {
    MAINBOARD,
    SIDEBOARD
}
