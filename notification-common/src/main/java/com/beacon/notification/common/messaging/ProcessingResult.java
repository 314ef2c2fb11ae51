package com.beacon.notification.common.messaging;

/**
 * Outcome of {@link ProcessingMiddleware#execute}. On failure the causing error is attached.
 */
public final class ProcessingResult {

    private static final ProcessingResult SUCCESS = new ProcessingResult(null);

    private final Throwable error;

    private ProcessingResult(Throwable error) {
        this.error = error;
    }

    public static ProcessingResult success() {
        return SUCCESS;
    }

    public static ProcessingResult failure(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("Failure result requires an error");
        }
        return new ProcessingResult(error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ProcessingResult{success}" : "ProcessingResult{failure=" + error + '}';
    }
}
