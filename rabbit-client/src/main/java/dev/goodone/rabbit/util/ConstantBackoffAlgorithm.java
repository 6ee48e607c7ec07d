package dev.goodone.rabbit.util;

public class ConstantBackoffAlgorithm implements BackoffAlgorithm {
    private final int backoffMs;

    public ConstantBackoffAlgorithm(int backoffMs) {
        if (backoffMs < 0) {
            throw new IllegalArgumentException("backoff must not be negative: " + backoffMs);
        }
        this.backoffMs = backoffMs;
    }

    @Override
    public int getDelayMs(Integer attempt) {
        return backoffMs;
    }
}
