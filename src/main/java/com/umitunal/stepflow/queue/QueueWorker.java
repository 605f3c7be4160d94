package com.umitunal.stepflow.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls a {@link WorkQueue} on a background thread and hands each due unit
 * to a {@link WorkProcessor}. One unit is processed at a time; run several
 * workers with distinct ids for parallelism.
 *
 * @param <T> the type of payload
 */
public class QueueWorker<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private final String workerId;
    private final WorkQueue<T> queue;
    private final WorkProcessor<T> processor;
    private final long leaseDuration;
    private final long pollInterval;
    private final long purgeInterval;
    private final AtomicBoolean running;
    private final AtomicLong processedCount;
    private final AtomicLong failedCount;
    private final AtomicLong discardedCount;

    private Thread workerThread;
    private long lastPurge;

    private QueueWorker(Builder<T> builder) {
        this.workerId = builder.workerId;
        this.queue = builder.queue;
        this.processor = builder.processor;
        this.leaseDuration = builder.leaseDuration;
        this.pollInterval = builder.pollInterval;
        this.purgeInterval = builder.purgeInterval;
        this.running = new AtomicBoolean(false);
        this.processedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
        this.discardedCount = new AtomicLong(0);
    }

    /**
     * Start the worker in the background. Leases left behind by a previous
     * run are released first.
     */
    public void start() throws Exception {
        if (running.compareAndSet(false, true)) {
            queue.recoverAbandoned();
            workerThread = new Thread(this::run, "QueueWorker-" + workerId);
            workerThread.setDaemon(false);
            workerThread.start();
            log.info("Worker {} started", workerId);
        }
    }

    /**
     * Stop the worker, waiting up to five seconds for the current unit.
     */
    public void stop() {
        running.set(false);
        if (workerThread != null) {
            try {
                workerThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("Worker {} stopped after {} processed, {} failed, {} discarded",
                    workerId, processedCount.get(), failedCount.get(), discardedCount.get());
        }
    }

    /**
     * Process a single unit synchronously.
     *
     * @return true if a unit was taken from the queue
     */
    public boolean processOne() throws Exception {
        QueuedWork<T> work = queue.acquire(workerId, leaseDuration);

        if (work == null) {
            return false;
        }

        WorkProcessor.ProcessingResult result;
        try {
            result = processor.process(work);
        } catch (Exception e) {
            queue.reject(work, e.getMessage());
            failedCount.incrementAndGet();
            throw e;
        }

        switch (result.getOutcome()) {
            case SUCCESS -> {
                queue.acknowledge(work);
                processedCount.incrementAndGet();
            }
            case RETRY -> {
                queue.reject(work, result.getMessage());
                failedCount.incrementAndGet();
            }
            case DISCARD -> {
                queue.acknowledge(work);
                discardedCount.incrementAndGet();
                log.warn("Worker {} discarded {}: {}", workerId, work.getId(), result.getMessage());
            }
        }
        return true;
    }

    private void run() {
        while (running.get()) {
            try {
                if (!processOne()) {
                    purgeFailedIfDue();
                    Thread.sleep(pollInterval);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Worker {} failed to process work", workerId, e);
            }
        }
    }

    // Runs on idle polls only
    private void purgeFailedIfDue() throws Exception {
        long now = System.currentTimeMillis();
        if (purgeInterval > 0 && now - lastPurge >= purgeInterval) {
            lastPurge = now;
            queue.purgeFailed();
        }
    }

    public String getWorkerId() { return workerId; }
    public long getProcessedCount() { return processedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public long getDiscardedCount() { return discardedCount.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }

    public static <T> Builder<T> builder(String workerId, WorkQueue<T> queue, WorkProcessor<T> processor) {
        return new Builder<>(workerId, queue, processor);
    }

    public static class Builder<T> {
        private final String workerId;
        private final WorkQueue<T> queue;
        private final WorkProcessor<T> processor;
        private long leaseDuration = 30000; // 30 seconds
        private long pollInterval = 1000;   // 1 second
        private long purgeInterval = 3_600_000; // 1 hour

        private Builder(String workerId, WorkQueue<T> queue, WorkProcessor<T> processor) {
            this.workerId = workerId;
            this.queue = queue;
            this.processor = processor;
        }

        public Builder<T> withLeaseDuration(long millis) {
            this.leaseDuration = millis;
            return this;
        }

        public Builder<T> withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        /**
         * How often an idle worker deletes failed work from the queue.
         * Zero or less keeps failed work until purged by hand.
         */
        public Builder<T> withFailedPurgeInterval(long millis) {
            this.purgeInterval = millis;
            return this;
        }

        public QueueWorker<T> build() {
            return new QueueWorker<>(this);
        }
    }
}
