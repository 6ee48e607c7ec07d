package dev.goodone.rabbit.util;

/**
 * Thrown by {@link BackoffRetrier} when every attempt of an operation failed.
 * The cause is the error of the last attempt.
 */
public class RetriesExhaustedException extends Exception {

    private final String operation;
    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable lastError) {
        super(operation + " failed after " + attempts + " attempts: " + lastError, lastError);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
