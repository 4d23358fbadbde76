package com.mtg.advisor.rng;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Mulberry32-backed score jitter.
 */
class ScoreJitterTest {

    @Test
    void testDeterministic() {
        ScoreJitter a = new ScoreJitter(12345);
        ScoreJitter b = new ScoreJitter(12345);
        for (int i = 0; i < 100; i++) {
            assertEquals(a.next(), b.next());
        }
    }

    @Test
    void testDifferentSeeds() {
        ScoreJitter a = new ScoreJitter(1);
        ScoreJitter b = new ScoreJitter(2);
        assertNotEquals(a.next(), b.next());
    }

    @Test
    void testRange() {
        ScoreJitter rng = new ScoreJitter(42);
        for (int i = 0; i < 1000; i++) {
            double v = rng.next();
            assertTrue(v >= 0.0 && v < 1.0, "Value out of range: " + v);
        }
    }

    @Test
    void testSignedRange() {
        ScoreJitter rng = new ScoreJitter(7);
        for (int i = 0; i < 1000; i++) {
            double v = rng.nextSigned(0.02);
            assertTrue(v >= -0.02 && v < 0.02, "Value out of range: " + v);
        }
    }

    @Test
    void testSeedUsesLower32Bits() {
        assertEquals(new ScoreJitter(5).next(), new ScoreJitter(5L | (1L << 40)).next());
    }

    @Test
    void testCardNameSeedIgnoresCase() {
        assertEquals(ScoreJitter.of("Lightning Bolt", 0.02), ScoreJitter.of("lightning bolt ", 0.02));
        assertNotEquals(ScoreJitter.of("Lightning Bolt", 0.02), ScoreJitter.of("Shock", 0.02));
    }

    @Test
    void testStateAdvances() {
        ScoreJitter rng = new ScoreJitter(0);
        long before = rng.getState();
        rng.next();
        assertNotEquals(before, rng.getState());
    }
}
