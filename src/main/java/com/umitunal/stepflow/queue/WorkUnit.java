package com.umitunal.stepflow.queue;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Stored form of queued work. Time-dependent operations take the current
 * time as an argument so the queue's clock decides what is due.
 *
 * @param <T> the type of the payload
 */
public class WorkUnit<T> implements QueuedWork<T> {
    private final String id;
    private final T payload;
    private long scheduledTime;
    private final int maxAttempts;

    private int currentAttempt;
    private long leaseExpiry;
    private String assignedWorker;
    private State state;
    private long createdAt;
    private String failureReason;
    private long version;  // For optimistic locking

    public WorkUnit(String id, T payload, long scheduledTime, int maxAttempts, long createdAt) {
        this.id = id;
        this.payload = payload;
        this.scheduledTime = scheduledTime;
        this.maxAttempts = maxAttempts;
        this.state = State.QUEUED;
        this.createdAt = createdAt;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public T getPayload() {
        return payload;
    }

    @Override
    public long getScheduledTime() {
        return scheduledTime;
    }

    @Override
    public State getState() {
        return state;
    }

    @Override
    public int getCurrentAttempt() {
        return currentAttempt;
    }

    @Override
    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public boolean canRetry() {
        return currentAttempt < maxAttempts;
    }

    public long getLeaseExpiry() { return leaseExpiry; }
    public String getAssignedWorker() { return assignedWorker; }
    public long getCreatedAt() { return createdAt; }
    public String getFailureReason() { return failureReason; }
    public long getVersion() { return version; }

    // Package-private setters for deserialization
    void setCurrentAttempt(int currentAttempt) { this.currentAttempt = currentAttempt; }
    void setLeaseExpiry(long leaseExpiry) { this.leaseExpiry = leaseExpiry; }
    void setAssignedWorker(String assignedWorker) { this.assignedWorker = assignedWorker; }
    void setState(State state) { this.state = state; }
    void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
    void setFailureReason(String failureReason) { this.failureReason = failureReason; }
    void setVersion(long version) { this.version = version; }

    public boolean isDue(long now) {
        return now >= scheduledTime;
    }

    public boolean isLeaseExpired(long now) {
        return now > leaseExpiry;
    }

    /**
     * Whether a worker may take this unit at {@code now}.
     */
    public boolean isAcquirable(long now) {
        return state == State.QUEUED
                || state == State.ABANDONED
                || (state == State.LEASED && isLeaseExpired(now));
    }

    public void lease(String workerId, long durationMs, long now) {
        this.assignedWorker = workerId;
        this.leaseExpiry = now + durationMs;
        this.state = State.LEASED;
        this.currentAttempt++;
        this.version++;
    }

    public void markFailed(String reason) {
        this.failureReason = reason;
        this.state = State.FAILED;
        this.version++;
    }

    public void markAbandoned() {
        this.state = State.ABANDONED;
        this.version++;
    }

    /**
     * Put the unit back in line for another attempt at {@code nextScheduledTime}.
     * The storage key changes with it.
     */
    public void resetForRetry(String reason, long nextScheduledTime) {
        this.scheduledTime = nextScheduledTime;
        this.state = State.QUEUED;
        this.assignedWorker = null;
        this.leaseExpiry = 0;
        this.failureReason = reason;
        this.version++;
    }

    @Override
    public String toString() {
        return String.format("WorkUnit{id='%s', state=%s, attempt=%d/%d, scheduled=%d, worker='%s'}",
                id, state, currentAttempt, maxAttempts, scheduledTime, assignedWorker);
    }

    /**
     * Storage key: [scheduledTime (8 bytes, big-endian)][workId (UTF-8)].
     * RocksDB's bytewise ordering then yields units in due-time order.
     */
    public static byte[] storageKey(long scheduledTime, String workId) {
        byte[] idBytes = workId.getBytes(UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(8 + idBytes.length);
        buffer.putLong(scheduledTime);
        buffer.put(idBytes);
        return buffer.array();
    }
}
