package com.umitunal.stepflow.queue;

import com.umitunal.stepflow.config.StorageConfig;
import com.umitunal.stepflow.model.Job;
import com.umitunal.stepflow.runner.RunJobCommand;
import com.umitunal.stepflow.spi.DelayedJobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Stores jobs in a {@link WorkQueue} so that a {@link QueueWorker} runs them
 * again once their delay has passed.
 *
 * Work ids combine the job id with its schedule extension count, so each
 * extension of the same job is a distinct queue entry.
 */
public class QueueDelayedJobDispatcher implements DelayedJobQueue {
    private static final Logger log = LoggerFactory.getLogger(QueueDelayedJobDispatcher.class);

    private final WorkQueue<RunJobCommand> queue;
    private final Clock clock;
    private final int maxAttempts;

    public QueueDelayedJobDispatcher(WorkQueue<RunJobCommand> queue, StorageConfig config, Clock clock) {
        this.queue = queue;
        this.clock = clock;
        this.maxAttempts = config.getMaxAttempts();
    }

    @Override
    public void queueJob(Job job, long delayMs) throws Exception {
        if (delayMs < 0) {
            throw new IllegalArgumentException("Delay must be non-negative: " + delayMs);
        }

        RunJobCommand command = new RunJobCommand(
                job.getId(), job.getEnvironmentId(), job.getOrganizationId(), job.getUserId());
        long scheduledTime = clock.millis() + delayMs;

        queue.enqueue(workId(job), command, scheduledTime, maxAttempts);
        log.debug("Job {} queued to run at {} ({} ms)", job.getId(), scheduledTime, delayMs);
    }

    /**
     * Queue a job to run as soon as a worker is free.
     */
    public void dispatch(Job job) throws Exception {
        queueJob(job, 0);
    }

    static String workId(Job job) {
        return job.getId() + "#" + job.getScheduleExtensionsCount();
    }
}
