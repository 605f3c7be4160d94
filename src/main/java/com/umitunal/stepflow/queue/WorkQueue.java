package com.umitunal.stepflow.queue;

/**
 * A persistent queue that releases work at its scheduled time and retries
 * rejected work until it runs out of attempts.
 *
 * @param <T> the type of payload
 */
public interface WorkQueue<T> extends AutoCloseable {

    /**
     * Store work for dispatch.
     *
     * @param workId identifier, unique together with the scheduled time
     * @param payload the work data
     * @param scheduledTime earliest dispatch time (millis since epoch)
     * @param maxAttempts number of attempts before the work is marked failed
     */
    void enqueue(String workId, T payload, long scheduledTime, int maxAttempts) throws Exception;

    /**
     * Lease the next work that is due.
     *
     * @param workerId identifier of the leasing worker
     * @param leaseDuration how long the worker may hold the work (milliseconds)
     * @return the leased work, or null if nothing is due
     */
    QueuedWork<T> acquire(String workerId, long leaseDuration) throws Exception;

    /**
     * Remove work that was handled.
     */
    void acknowledge(QueuedWork<T> work) throws Exception;

    /**
     * Return work to the queue for another attempt after a backoff delay,
     * or mark it failed when no attempts are left. Failed work stays stored
     * until {@link #purgeFailed()}.
     */
    void reject(QueuedWork<T> work, String reason) throws Exception;

    /**
     * Release work whose lease expired.
     *
     * @return number of leases released
     */
    long recoverAbandoned() throws Exception;

    /**
     * Delete all work marked failed.
     *
     * @return number of units deleted
     */
    long purgeFailed() throws Exception;

    QueueMetrics getMetrics() throws Exception;
}
