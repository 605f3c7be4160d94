package com.umitunal.stepflow.error;

/**
 * A step failure raised by a collaborator, carrying its classification.
 */
public class StepExecutionException extends StepflowException {
    private final FailureKind kind;

    public StepExecutionException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StepExecutionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static StepExecutionException backoff(String message) {
        return new StepExecutionException(FailureKind.BACKOFF, message);
    }

    public FailureKind getKind() { return kind; }
}
