package dev.goodone.rabbit.util;

/**
 * Computes how long to wait before the given retry attempt.
 */
public interface BackoffAlgorithm {

    /**
     * @param attempt the retry about to be made, starting at 1 for the first retry
     * @return the delay in milliseconds
     */
    int getDelayMs(Integer attempt);
}
