package com.olympus.realtime;

/**
 * Fixed-delay reconnection with a bounded number of attempts.
 * Not thread-safe; owned by the channel thread.
 */
public class ReconnectPolicy {

    private final long delayMillis;
    private final int maxAttempts;
    private int attempts;

    public ReconnectPolicy(long delayMillis, int maxAttempts) {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must be >= 0: " + delayMillis);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
        }
        this.delayMillis = delayMillis;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Claim the next attempt.
     *
     * @return the attempt number (1-based)
     * @throws IllegalStateException if the budget is exhausted
     */
    public int nextAttempt() {
        if (isExhausted()) {
            throw new IllegalStateException("Reconnect attempts exhausted (" + maxAttempts + ")");
        }
        return ++attempts;
    }

    public boolean isExhausted() {
        return attempts >= maxAttempts;
    }

    public void reset() {
        attempts = 0;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getDelayMillis() {
        return delayMillis;
    }
}
