package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;

/**
 * Marks a job as failed after an error outside of its own execution,
 * e.g. while it was being queued.
 */
@FunctionalInterface
public interface JobFailureRecorder {

    void markFailed(Job job, Exception error) throws Exception;
}
