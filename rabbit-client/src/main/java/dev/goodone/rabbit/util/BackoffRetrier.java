package dev.goodone.rabbit.util;

import java.util.concurrent.Callable;

/**
 * Runs an operation until it succeeds or the retry budget is spent, sleeping between attempts
 * according to a {@link BackoffAlgorithm}.
 *
 * The operation is invoked at most {@code maxRetries + 1} times. Interrupting the calling thread while it
 * waits for the next attempt aborts the loop with an {@link InterruptedException}.
 */
public class BackoffRetrier {

    private static final Logger log = new Logger(BackoffRetrier.class);

    private final int maxRetries;
    private final BackoffAlgorithm backoffAlgorithm;

    public BackoffRetrier(int maxRetries, BackoffAlgorithm backoffAlgorithm) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.backoffAlgorithm = backoffAlgorithm;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public <T> T retryWithBackoff(String operation, Callable<T> fn) throws RetriesExhaustedException, InterruptedException {
        Exception lastError = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                int delayMs = backoffAlgorithm.getDelayMs(attempt);
                log.warnWithParams("Retrying operation.",
                        "operation", operation,
                        "attempt", attempt,
                        "maxRetries", maxRetries,
                        "delayMillis", delayMs);
                Thread.sleep(delayMs);
            }
            try {
                T result = fn.call();
                if (attempt > 0) {
                    log.infoWithParams("Operation succeeded after retrying.",
                            "operation", operation,
                            "attempts", attempt + 1);
                }
                return result;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                lastError = e;
                log.debugWithParams("Attempt failed.",
                        "operation", operation,
                        "attempt", attempt,
                        "error", e.toString());
            }
        }
        throw new RetriesExhaustedException(operation, maxRetries + 1, lastError);
    }
}
