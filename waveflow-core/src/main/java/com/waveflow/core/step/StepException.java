package com.waveflow.core.step;

/**
 * Failure reported by a step or rollback action.
 *
 * A retryable failure lets the step use its remaining retries; a permanent one
 * fails the step at once.
 */
public class StepException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    /**
     * Create a retryable failure.
     */
    public StepException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    private StepException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static StepException permanent(String errorCode, String message) {
        return new StepException(errorCode, message, false);
    }

    public static StepException transientFailure(String errorCode, String message) {
        return new StepException(errorCode, message, true);
    }
}
