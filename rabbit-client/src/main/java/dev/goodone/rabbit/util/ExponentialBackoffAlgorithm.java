package dev.goodone.rabbit.util;

/**
 * Doubles the delay for every retry, starting at the initial backoff and capped at the max backoff.
 *
 * <pre>
 * retry 1 -> initial
 * retry 2 -> initial * 2
 * retry n -> min(initial * 2^(n-1), max)
 * </pre>
 */
public class ExponentialBackoffAlgorithm implements BackoffAlgorithm {

    private final int initialBackoffMs;
    private final int maxBackoffMs;

    public ExponentialBackoffAlgorithm(int initialBackoffMs, int maxBackoffMs) {
        if (initialBackoffMs < 0 || maxBackoffMs < 0) {
            throw new IllegalArgumentException("backoff values must not be negative");
        }
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    @Override
    public int getDelayMs(Integer attempt) {
        if (attempt == null || attempt <= 1) {
            return Math.min(initialBackoffMs, maxBackoffMs);
        }
        // 2^30 already overflows any sane backoff, stop doubling there
        int exponent = Math.min(attempt - 1, 30);
        long delay = (long) initialBackoffMs << exponent;
        return (int) Math.min(delay, maxBackoffMs);
    }
}
