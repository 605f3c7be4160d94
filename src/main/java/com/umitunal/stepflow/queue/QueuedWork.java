package com.umitunal.stepflow.queue;

/**
 * A payload waiting in the dispatch queue, together with its delivery state.
 *
 * @param <T> the type of the payload
 */
public interface QueuedWork<T> {

    /**
     * Gets the identifier of this piece of work.
     */
    String getId();

    T getPayload();

    /**
     * Gets the earliest dispatch time in milliseconds since epoch.
     */
    long getScheduledTime();

    State getState();

    /**
     * Gets the number of attempts started so far.
     */
    int getCurrentAttempt();

    int getMaxAttempts();

    boolean canRetry();

    /**
     * Delivery states of queued work.
     */
    enum State {
        QUEUED,      // Waiting for its scheduled time or a worker
        LEASED,      // Held by a worker
        FAILED,      // Out of attempts
        ABANDONED    // Lease expired without an answer, will be handed out again
    }
}
