package io.timecapsule4j.core;

public class RetryExhaustedException extends CapsuleStoreException {

    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(operation + " failed after " + attempts + " attempts"
                + (lastFailure != null ? ": " + lastFailure.getMessage() : ""), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
