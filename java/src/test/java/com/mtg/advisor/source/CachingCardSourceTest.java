package com.mtg.advisor.source;

import com.mtg.advisor.card.Card;
import com.mtg.advisor.deck.DeckFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class CachingCardSourceTest {
    private static final SearchOptions OPTIONS = SearchOptions.forFormat("modern", SearchOptions.Order.EDHREC, 10);

    private final FakeCardSource fake = new FakeCardSource();
    private final AtomicLong ticker = new AtomicLong();
    private final CachingCardSource cache = new CachingCardSource(fake, Duration.ofMinutes(5), 100,
            new RequestThrottle(Duration.ZERO), ticker::get);

    @Test
    void testRepeatedQueryHitsCache() {
        List<Card> first = cache.search("c:r", OPTIONS);
        List<Card> second = cache.search("c:r", OPTIONS);
        assertEquals(first, second);
        assertEquals(1, fake.callCount());
        assertEquals(1, cache.getOutboundRequests());
        assertEquals(1, cache.searchStats().hitCount());
    }

    @Test
    void testOptionsArePartOfTheKey() {
        cache.search("c:r", OPTIONS);
        cache.search("c:r", OPTIONS.withLimit(20));
        assertEquals(2, fake.callCount());
    }

    @Test
    void testEntriesExpire() {
        cache.search("c:r", OPTIONS);
        ticker.addAndGet(Duration.ofMinutes(4).toNanos());
        cache.search("c:r", OPTIONS);
        assertEquals(1, fake.callCount());

        ticker.addAndGet(Duration.ofMinutes(2).toNanos());
        cache.search("c:r", OPTIONS);
        assertEquals(2, fake.callCount());
    }

    @Test
    void testFailureYieldsEmptyAndIsNotCached() {
        fake.failNext(1);
        assertTrue(cache.search("c:r", OPTIONS).isEmpty());
        assertEquals(10, cache.search("c:r", OPTIONS).size());
        assertEquals(2, fake.callCount());
    }

    @Test
    void testUnexpectedErrorYieldsEmptyAndIsNotCached() {
        AtomicInteger calls = new AtomicInteger();
        CardSource flaky = new CardSource() {
            @Override
            public List<Card> search(String query, SearchOptions options) throws CardSourceException {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("corrupt page");
                }
                return fake.search(query, options);
            }

            @Override
            public Optional<Card> getByName(String name) {
                throw new IllegalStateException("corrupt card");
            }
        };
        CachingCardSource guarded = new CachingCardSource(flaky, Duration.ofMinutes(5), 100,
                new RequestThrottle(Duration.ZERO), ticker::get);

        assertTrue(guarded.search("c:r", OPTIONS).isEmpty());
        assertEquals(10, guarded.search("c:r", OPTIONS).size());
        assertEquals(2, calls.get());
        assertTrue(guarded.getByName("Lightning Bolt").isEmpty());
    }

    @Test
    void testNamedLookup() {
        fake.register(DeckFixtures.LIGHTNING_BOLT);
        assertTrue(cache.getByName("Lightning Bolt").isPresent());
        assertTrue(cache.getByName("LIGHTNING BOLT").isPresent());
        assertEquals(1, fake.callCount());

        assertTrue(cache.getByName("Nope").isEmpty());
        assertTrue(cache.getByName("Nope").isEmpty());
        assertEquals(2, fake.callCount());
    }

    @Test
    void testNamedFailureYieldsEmpty() {
        fake.setFailing(true);
        assertTrue(cache.getByName("Lightning Bolt").isEmpty());
    }

    @Test
    void testInvalidateAll() {
        cache.search("c:r", OPTIONS);
        cache.invalidateAll();
        cache.search("c:r", OPTIONS);
        assertEquals(2, fake.callCount());
    }

    @Test
    void testMissesAreThrottled() {
        AtomicLong clock = new AtomicLong();
        AtomicLong slept = new AtomicLong();
        RequestThrottle throttle = new RequestThrottle(Duration.ofMillis(100), clock::get, nanos -> {
            slept.addAndGet(nanos);
            clock.addAndGet(nanos);
        });
        CachingCardSource throttled = new CachingCardSource(fake, Duration.ofMinutes(5), 100, throttle, ticker::get);
        throttled.search("c:r", OPTIONS);
        throttled.search("c:g", OPTIONS);
        throttled.search("c:g", OPTIONS);
        assertEquals(Duration.ofMillis(100).toNanos(), slept.get());
    }
}
