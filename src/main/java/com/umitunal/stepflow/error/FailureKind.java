package com.umitunal.stepflow.error;

/**
 * Classification of step failures, decided by whoever raises them.
 */
public enum FailureKind {
    GENERAL,   // Recorded, chain follows the halt-on-failure policy
    BACKOFF;   // Transient, chain waits for the external retry

    /**
     * Classify an error by walking its cause chain.
     *
     * @param error the caught error, may be null
     * @return BACKOFF if any link is a backoff step failure, otherwise GENERAL
     */
    public static FailureKind of(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof StepExecutionException
                    && ((StepExecutionException) current).getKind() == BACKOFF) {
                return BACKOFF;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return GENERAL;
    }
}
