package com.umitunal.stepflow.queue;

/**
 * Handles work leased from a {@link WorkQueue}.
 *
 * @param <T> the type of payload
 */
@FunctionalInterface
public interface WorkProcessor<T> {

    /**
     * @param work the leased work
     * @return how the queue should settle the work
     * @throws Exception if processing fails; the work is retried
     */
    ProcessingResult process(QueuedWork<T> work) throws Exception;

    /**
     * Result of processing.
     */
    class ProcessingResult {

        public enum Outcome {
            SUCCESS,     // Acknowledge
            RETRY,       // Reject, the queue retries while attempts remain
            DISCARD      // Acknowledge without success, retrying cannot help
        }

        private final Outcome outcome;
        private final String message;

        private ProcessingResult(Outcome outcome, String message) {
            this.outcome = outcome;
            this.message = message;
        }

        public Outcome getOutcome() { return outcome; }
        public String getMessage() { return message; }

        public boolean isSuccess() {
            return outcome == Outcome.SUCCESS;
        }

        public static ProcessingResult success() {
            return new ProcessingResult(Outcome.SUCCESS, null);
        }

        public static ProcessingResult retry(String message) {
            return new ProcessingResult(Outcome.RETRY, message);
        }

        public static ProcessingResult discard(String message) {
            return new ProcessingResult(Outcome.DISCARD, message);
        }
    }
}
