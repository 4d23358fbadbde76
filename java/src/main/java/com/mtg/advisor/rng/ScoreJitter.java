package com.mtg.advisor.rng;

import com.mtg.advisor.card.CardNames;

/**
 * Deterministic score jitter. Seeds a Mulberry32 generator from the card name so
 * similar cards get slightly different scores while every run stays reproducible.
 */
public class ScoreJitter {
    private long state;

    /**
     * Create a generator with the specified seed.
     * Uses the lower 32 bits of the seed.
     */
    public ScoreJitter(long seed) {
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a generator seeded from a card name (case-insensitive).
     */
    public static ScoreJitter forCard(String cardName) {
        return new ScoreJitter(CardNames.normalize(cardName).hashCode());
    }

    /**
     * Jitter for a card name, uniform in [-amplitude, amplitude).
     */
    public static double of(String cardName, double amplitude) {
        return forCard(cardName).nextSigned(amplitude);
    }

    /**
     * Generate next random number in [0, 1).
     * Mulberry32 algorithm.
     */
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;
        return result / 4294967296.0;
    }

    /**
     * Next value uniform in [-amplitude, amplitude).
     */
    public double nextSigned(double amplitude) {
        return (next() * 2.0 - 1.0) * amplitude;
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
