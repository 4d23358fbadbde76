package com.mtg.advisor.source;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Spaces outbound requests at least {@code minInterval} apart.
 */
public class RequestThrottle {

    /**
     * Blocking pause, replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }

    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private long lastRequestNanos;
    private boolean firstRequest = true;

    public RequestThrottle(Duration minInterval) {
        this(minInterval, System::nanoTime,
                nanos -> Thread.sleep(nanos / 1_000_000, (int) (nanos % 1_000_000)));
    }

    public RequestThrottle(Duration minInterval, LongSupplier nanoClock, Sleeper sleeper) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("Minimum interval cannot be negative");
        }
        this.minIntervalNanos = minInterval.toNanos();
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    /**
     * Wait until the minimum interval since the previous request has elapsed.
     *
     * @return nanoseconds spent waiting
     * @throws CardSourceException if interrupted while waiting
     */
    public synchronized long acquire() throws CardSourceException {
        long now = nanoClock.getAsLong();
        long waited = 0;
        if (!firstRequest) {
            long wait = lastRequestNanos + minIntervalNanos - now;
            if (wait > 0) {
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CardSourceException("Interrupted while waiting for request slot", e);
                }
                waited = wait;
                now = Math.max(nanoClock.getAsLong(), lastRequestNanos + minIntervalNanos);
            }
        }
        firstRequest = false;
        lastRequestNanos = now;
        return waited;
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
