package com.umitunal.stepflow.queue;

/**
 * Counts of queued work per state.
 */
public class QueueMetrics {
    private final long total;
    private final long queued;
    private final long leased;
    private final long failed;
    private final long abandoned;

    public QueueMetrics(long total, long queued, long leased, long failed, long abandoned) {
        this.total = total;
        this.queued = queued;
        this.leased = leased;
        this.failed = failed;
        this.abandoned = abandoned;
    }

    public long getTotal() { return total; }
    public long getQueued() { return queued; }
    public long getLeased() { return leased; }
    public long getFailed() { return failed; }
    public long getAbandoned() { return abandoned; }

    @Override
    public String toString() {
        return String.format("QueueMetrics{total=%d, queued=%d, leased=%d, failed=%d, abandoned=%d}",
                total, queued, leased, failed, abandoned);
    }
}
