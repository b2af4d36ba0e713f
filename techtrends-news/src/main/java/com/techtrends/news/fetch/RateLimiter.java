package com.techtrends.news.fetch;

import java.time.Duration;

/**
 * Paces outbound requests to a source.
 * Consecutive {@link #acquire()} calls return at least {@link #getMinDelay()} apart.
 */
public interface RateLimiter {

    /**
     * Acquire permission to make a request.
     * Blocks if necessary to respect the minimum delay.
     */
    void acquire();

    /**
     * Minimum delay between two consecutive requests.
     */
    Duration getMinDelay();

    static RateLimiter fixedDelay(Duration minDelay) {
        return new FixedDelayRateLimiter(minDelay, Ticker.system());
    }

    static RateLimiter fixedDelay(Duration minDelay, Ticker ticker) {
        return new FixedDelayRateLimiter(minDelay, ticker);
    }

    /**
     * Time source and sleep used by a rate limiter. Tests substitute a fake clock.
     */
    interface Ticker {

        long nanoTime();

        void sleep(Duration duration) throws InterruptedException;

        static Ticker system() {
            return new Ticker() {
                @Override
                public long nanoTime() {
                    return System.nanoTime();
                }

                @Override
                public void sleep(Duration duration) throws InterruptedException {
                    Thread.sleep(duration.toMillis(), (int) (duration.toNanos() % 1_000_000));
                }
            };
        }
    }
}

/**
 * Fixed-delay rate limiter implementation.
 */
class FixedDelayRateLimiter implements RateLimiter {
    private final Duration minDelay;
    private final Ticker ticker;
    private long lastRequestNanos;
    private boolean started;

    FixedDelayRateLimiter(Duration minDelay, Ticker ticker) {
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("Delay must not be negative: " + minDelay);
        }
        this.minDelay = minDelay;
        this.ticker = ticker;
    }

    @Override
    public synchronized void acquire() {
        if (started) {
            long elapsed = ticker.nanoTime() - lastRequestNanos;
            long remaining = minDelay.toNanos() - elapsed;
            if (remaining > 0) {
                try {
                    ticker.sleep(Duration.ofNanos(remaining));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        lastRequestNanos = ticker.nanoTime();
        started = true;
    }

    @Override
    public Duration getMinDelay() {
        return minDelay;
    }
}
